package clarity.processor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeMirror;
import javax.tools.Diagnostic.Kind;

import com.google.auto.service.AutoService;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;
import com.squareup.javapoet.WildcardTypeName;

/**
 * Generates the visitor plumbing for the syntax tree.
 *
 * <p>Every {@link ASTNode} type {@code Outer.Inner} must implement {@code Outer_Inner_ASTNode},
 * which this processor writes with default {@code accept} and {@code visitChildren} methods. Once
 * all rounds are done, {@code ASTVisitor} (one {@code visit} overload per node), {@code
 * DefaultASTVisitor} and {@code VoidDefaultASTVisitor} are written for every node seen.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  private static final String PACKAGE = "clarity";

  private static final ClassName NODE_INTERFACE = ClassName.get(PACKAGE, "ASTNodeInterface");
  private static final ClassName NODE_UTILS = ClassName.get(PACKAGE, "ASTNodeUtils");
  private static final ClassName VISITOR = ClassName.get(PACKAGE, "ASTVisitor");
  private static final ClassName DEFAULT_VISITOR = ClassName.get(PACKAGE, "DefaultASTVisitor");
  private static final ClassName VOID_DEFAULT_VISITOR =
      ClassName.get(PACKAGE, "VoidDefaultASTVisitor");

  private static final TypeVariableName V = TypeVariableName.get("V");
  private static final ClassName VOID = ClassName.get(Void.class);

  // Keyed by qualified name so the generated overloads come out in a stable order.
  private final Map<String, TypeName> nodeTypes = new TreeMap<>();

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    if (roundEnv.processingOver()) {
      // Nothing to generate for a compilation without nodes, e.g. the tests.
      if (!nodeTypes.isEmpty()) {
        write(visitorInterface());
        write(defaultVisitor());
        write(voidDefaultVisitor());
      }
      return true;
    }

    for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
      TypeElement type = (TypeElement) element;
      nodeTypes.put(type.getQualifiedName().toString(), nodeTypeName(type));
      nodeInterface(type).ifPresent(this::write);
    }
    return true;
  }

  private void write(TypeSpec typeSpec) {
    try {
      JavaFile.builder(PACKAGE, typeSpec).build().writeTo(processingEnv.getFiler());
    } catch (IOException ex) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "cannot write " + typeSpec.name + ": " + ex);
    }
  }

  private void error(String msg, Element element) {
    processingEnv.getMessager().printMessage(Kind.ERROR, msg, element);
  }

  private static TypeName nodeTypeName(TypeElement type) {
    ClassName name = ClassName.get(type);
    if (type.getTypeParameters().isEmpty()) return name;

    TypeName[] wildcards = new TypeName[type.getTypeParameters().size()];
    for (int i = 0; i < wildcards.length; i++) {
      wildcards[i] = WildcardTypeName.subtypeOf(Object.class);
    }
    return ParameterizedTypeName.get(name, wildcards);
  }

  // AST.Element -> AST_Element_ASTNode
  private static String nodeInterfaceName(TypeElement type) {
    List<String> names = new ArrayList<>();
    for (Element e = type; e.getKind() != ElementKind.PACKAGE; e = e.getEnclosingElement()) {
      if (e.getKind().isClass() || e.getKind().isInterface()) {
        names.add(e.getSimpleName().toString());
      }
    }
    Collections.reverse(names);
    names.add("ASTNode");
    return Joiner.on('_').join(names);
  }

  private static boolean implementsInterface(TypeElement type, String simpleName) {
    for (TypeMirror iface : type.getInterfaces()) {
      String name = iface.toString();
      if (name.equals(simpleName) || name.endsWith("." + simpleName)) return true;
    }
    return false;
  }

  private Optional<TypeSpec> nodeInterface(TypeElement type) {
    String name = nodeInterfaceName(type);
    if (!implementsInterface(type, name)) {
      error("@ASTNode type must implement " + name, type);
      return Optional.empty();
    }

    TypeName visitorOfV = ParameterizedTypeName.get(VISITOR, V);
    TypeSpec.Builder spec =
        TypeSpec.interfaceBuilder(name)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(NODE_INTERFACE)
            .addMethod(
                MethodSpec.methodBuilder("accept")
                    .addAnnotation(Override.class)
                    .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
                    .addTypeVariable(V)
                    .returns(V)
                    .addParameter(visitorOfV, "visitor")
                    .addParameter(V, "value")
                    .addStatement("return visitor.visit(($T) this, value)", nodeTypeName(type))
                    .build());

    MethodSpec.Builder visitChildren =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorOfV, "visitor")
            .addParameter(V, "value");

    for (Element member : type.getEnclosedElements()) {
      if (member.getKind() != ElementKind.METHOD || member.getAnnotation(ASTChild.class) == null) {
        continue;
      }
      if (member.getAnnotation(Override.class) == null) {
        error("@ASTChild accessor must be marked @Override", member);
      }

      // Redeclared here so the default visitChildren can call the accessor.
      ExecutableElement accessor = (ExecutableElement) member;
      String accessorName = accessor.getSimpleName().toString();
      spec.addMethod(
          MethodSpec.methodBuilder(accessorName)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(accessor.getReturnType()))
              .build());
      visitChildren.addStatement(
          "value = $T.accept($N(), visitor, value)", NODE_UTILS, accessorName);
    }

    spec.addMethod(visitChildren.addStatement("return value").build());
    return Optional.of(spec.build());
  }

  private TypeSpec visitorInterface() {
    TypeSpec.Builder spec = TypeSpec.interfaceBuilder(VISITOR).addTypeVariable(V);
    for (TypeName node : nodeTypes.values()) {
      spec.addMethod(
          MethodSpec.methodBuilder("visit")
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .build());
    }
    return spec.build();
  }

  private TypeSpec defaultVisitor() {
    TypeSpec.Builder spec =
        TypeSpec.classBuilder(DEFAULT_VISITOR)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(ParameterizedTypeName.get(VISITOR, V));
    for (TypeName node : nodeTypes.values()) {
      spec.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .addStatement("return node.visitChildren(this, value)")
              .build());
    }
    return spec.build();
  }

  private TypeSpec voidDefaultVisitor() {
    TypeSpec.Builder spec =
        TypeSpec.classBuilder(VOID_DEFAULT_VISITOR)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(ParameterizedTypeName.get(DEFAULT_VISITOR, VOID));
    for (TypeName node : nodeTypes.values()) {
      spec.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
              .returns(VOID)
              .addParameter(node, "node")
              .addParameter(VOID, "value")
              .addStatement("visitImpl(node)")
              .addStatement("return null")
              .build());
      spec.addMethod(
          MethodSpec.methodBuilder("visitImpl")
              .addModifiers(Modifier.PUBLIC)
              .addParameter(node, "node")
              .addStatement("node.visitChildren(this, null)")
              .build());
    }
    return spec.build();
  }
}
