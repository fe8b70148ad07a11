package clarity;

import java.util.ArrayDeque;
import java.util.Deque;

import com.google.auto.value.AutoValue;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/** Produces a tokenization of the input, including INDENT and DEDENT for block structure. */
public class Tokenizer {
  public static class Pos {
    private final String file;
    private final int lineNumber;
    private final int column;

    public Pos(String file, int lineNumber, int column) {
      this.file = file;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    public String file() {
      return file;
    }

    public int lineNumber() {
      return lineNumber;
    }

    public int column() {
      return column;
    }

    public Pos addColumns(int columns) {
      return new Pos(file, lineNumber, column + columns);
    }

    @Override
    public String toString() {
      return String.format("%s@%d:%d", file, lineNumber + 1, column + 1);
    }
  }

  public enum TokenType {
    ELEMENT,
    ATTRIBUTE,
    CONTENT,
    STRING,
    MULTILINE_STRING,
    VARIABLE_DECL,
    VARIABLE_REF,
    COLON,
    FOR_LOOP,
    IF_STATEMENT,
    ELSE_STATEMENT,
    COMPONENT_DEF,
    COMPONENT_USE,
    COMMENT,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF;
  }

  @AutoValue
  public abstract static class Token {
    public abstract TokenType type();

    /** The raw lexeme. Strings keep their quotes, headers keep their keyword. */
    public abstract String text();

    public abstract Pos pos();

    public boolean is(TokenType type) {
      return type() == type;
    }

    public static Token create(TokenType type, String text, Pos pos) {
      return new AutoValue_Tokenizer_Token(type, text, pos);
    }

    @Override
    public String toString() {
      return String.format("%s('%s') at %s", type(), text(), pos());
    }
  }

  public static final char QUOTE = '"';
  public static final char SINGLE_QUOTE = '\'';
  public static final String TRIPLE_QUOTE = "\"\"\"";
  public static final String TRIPLE_SINGLE_QUOTE = "'''";

  private static final String COMPONENT_KEYWORD = "@component";

  private final String file;
  private final String source;
  private int position = 0;
  private int line = 0;
  private int lineStart = 0;

  // Widths of the open blocks; the bottom entry is always 0.
  private final Deque<Integer> indentStack = new ArrayDeque<>();

  private final ImmutableList.Builder<Token> tokensBuilder = ImmutableList.builder();

  public Tokenizer(String file, String content) {
    this.file = file;
    this.source = content;
    indentStack.push(0);
  }

  public ImmutableList<Token> tokenize() throws CompilerException {
    while (position < source.length()) {
      if (position == 0 || source.charAt(position - 1) == '\n') {
        readIndentation();
        if (position >= source.length()) break;
      }

      char ch = source.charAt(position);
      if (source.startsWith(TRIPLE_QUOTE, position)
          || source.startsWith(TRIPLE_SINGLE_QUOTE, position)) {
        readMultilineString();
      } else if (ch == '#') {
        readComment();
      } else if (ch == QUOTE || ch == SINGLE_QUOTE) {
        readString();
      } else if (ch == '$') {
        if (isVariableDeclaration()) {
          readVariableDeclaration();
        } else {
          readVariableReference();
        }
      } else if (ch == ':') {
        add(TokenType.COLON, ":", pos());
        position++;
      } else if (ch == '@') {
        if (isKeyword(COMPONENT_KEYWORD)) {
          readHeader(TokenType.COMPONENT_DEF, true);
        } else {
          readHeader(TokenType.COMPONENT_USE, true);
        }
      } else if (ch == '\n') {
        add(TokenType.NEWLINE, "\n", pos());
        newline();
      } else if (isKeyword("for")) {
        readHeader(TokenType.FOR_LOOP, false);
      } else if (isKeyword("if")) {
        readHeader(TokenType.IF_STATEMENT, false);
      } else if (isKeyword("else")) {
        readHeader(TokenType.ELSE_STATEMENT, true);
      } else if (isIdentifierStart(ch)) {
        readElementOrContent();
      } else {
        position++;
      }
    }

    while (indentStack.peek() > 0) {
      indentStack.pop();
      add(TokenType.DEDENT, "", pos());
    }
    add(TokenType.EOF, "", pos());

    return tokensBuilder.build();
  }

  private CompilerException error(Pos pos, String msg) {
    return new CompilerException(pos, msg);
  }

  private Pos pos() {
    return new Pos(file, line, position - lineStart);
  }

  private void add(TokenType type, String text, Pos pos) {
    tokensBuilder.add(Token.create(type, text, pos));
  }

  // Consumes the current '\n'.
  private void newline() {
    position++;
    line++;
    lineStart = position;
  }

  private static boolean isLineSpace(char ch) {
    return ch != '\n' && Character.isWhitespace(ch);
  }

  private static boolean isIdentifierStart(char ch) {
    return Character.isLetter(ch) || ch == '_';
  }

  private static boolean isIdentifierPart(char ch) {
    return Character.isLetterOrDigit(ch) || ch == '_';
  }

  private boolean isKeyword(String keyword) {
    if (!source.startsWith(keyword, position)) return false;

    int after = position + keyword.length();
    return after >= source.length() || !isIdentifierPart(source.charAt(after));
  }

  private void readIndentation() throws CompilerException {
    int width = 0;
    while (position < source.length() && isLineSpace(source.charAt(position))) {
      width++;
      position++;
    }

    // Blank lines, comment lines and trailing whitespace leave the block structure alone.
    if (position >= source.length()
        || source.charAt(position) == '\n'
        || source.charAt(position) == '#') {
      return;
    }

    Pos pos = new Pos(file, line, 0);
    if (width > indentStack.peek()) {
      indentStack.push(width);
      add(TokenType.INDENT, Strings.repeat(" ", width), pos);
    } else if (width < indentStack.peek()) {
      while (width < indentStack.peek()) {
        indentStack.pop();
        add(TokenType.DEDENT, "", pos);
      }

      if (width != indentStack.peek()) {
        throw error(
            pos.addColumns(width),
            String.format("inconsistent indentation at line %d", line + 1));
      }
    }
  }

  private void readComment() {
    Pos start = pos();
    int startPosition = position;
    while (position < source.length() && source.charAt(position) != '\n') position++;

    add(TokenType.COMMENT, source.substring(startPosition, position), start);
  }

  private void readMultilineString() throws CompilerException {
    Pos start = pos();
    int startPosition = position;
    String delimiter = source.substring(position, position + 3);
    position += 3;

    while (!source.startsWith(delimiter, position)) {
      if (position >= source.length()) {
        throw error(
            start,
            String.format(
                "unterminated multi-line string starting at line %d", start.lineNumber() + 1));
      }

      if (source.charAt(position) == '\n') {
        newline();
      } else {
        position++;
      }
    }

    position += 3;
    add(TokenType.MULTILINE_STRING, source.substring(startPosition, position), start);
  }

  private void readString() throws CompilerException {
    Pos start = pos();
    int startPosition = position;
    char quote = source.charAt(position++);

    while (position < source.length()
        && !(source.charAt(position) == quote && source.charAt(position - 1) != '\\')) {
      if (source.charAt(position) == '\n') {
        newline();
      } else {
        position++;
      }
    }

    if (position >= source.length()) {
      throw error(start, String.format("unterminated string at line %d", start.lineNumber() + 1));
    }

    position++;
    add(TokenType.STRING, source.substring(startPosition, position), start);
  }

  private boolean isVariableDeclaration() {
    int i = position + 1;
    while (i < source.length() && isIdentifierPart(source.charAt(i))) i++;
    while (i < source.length() && isLineSpace(source.charAt(i))) i++;
    return i < source.length() && source.charAt(i) == '=';
  }

  private void readVariableDeclaration() {
    Pos start = pos();
    int startPosition = position;

    // The value runs to the end of the line, or to a comment outside of quotes.
    char quote = 0;
    while (position < source.length() && source.charAt(position) != '\n') {
      char ch = source.charAt(position);
      if (quote != 0) {
        if (ch == quote) quote = 0;
      } else if (ch == QUOTE || ch == SINGLE_QUOTE) {
        quote = ch;
      } else if (ch == '#') {
        break;
      }
      position++;
    }

    add(TokenType.VARIABLE_DECL, source.substring(startPosition, position).trim(), start);
  }

  private void readVariableReference() {
    Pos start = pos();
    int startPosition = position++;
    while (position < source.length() && isIdentifierPart(source.charAt(position))) position++;

    add(TokenType.VARIABLE_REF, source.substring(startPosition, position), start);
  }

  // Reads a statement header up to the first colon or the end of the line.
  private void readHeader(TokenType type, boolean includeColon) {
    Pos start = pos();
    int startPosition = position;
    while (position < source.length() && source.charAt(position) != '\n') {
      if (source.charAt(position) == ':') {
        if (includeColon) position++;
        break;
      }
      position++;
    }

    add(type, source.substring(startPosition, position).trim(), start);
  }

  private void readElementOrContent() {
    Pos start = pos();
    int startPosition = position;
    while (position < source.length()
        && (isIdentifierPart(source.charAt(position)) || source.charAt(position) == '-')) {
      position++;
    }
    String name = source.substring(startPosition, position);

    int next = position;
    while (next < source.length() && isLineSpace(source.charAt(next))) next++;
    char nextCh = next < source.length() ? source.charAt(next) : '\n';

    if (nextCh == '\n' || nextCh == '#') {
      add(TokenType.CONTENT, name, start);
      return;
    }

    add(TokenType.ELEMENT, name, start);
    if (nextCh == ':') return;

    Pos attributesStart = pos();
    int attributesPosition = position;
    while (position < source.length()
        && source.charAt(position) != ':'
        && source.charAt(position) != '\n') {
      position++;
    }

    String attributes = source.substring(attributesPosition, position).trim();
    if (!attributes.isEmpty()) {
      add(
          TokenType.ATTRIBUTE,
          attributes,
          attributesStart.addColumns(leadingSpaces(attributesPosition)));
    }
  }

  private int leadingSpaces(int from) {
    int count = 0;
    while (from + count < source.length() && isLineSpace(source.charAt(from + count))) count++;
    return count;
  }
}
