package com.codemigration.metagraph.extraction.parser;

import com.codemigration.metagraph.exception.MalformedInputException;
import com.codemigration.metagraph.extraction.ParsedSkeleton;
import com.codemigration.metagraph.extraction.SourceUnit;
import com.codemigration.metagraph.model.entity.Argument;
import com.codemigration.metagraph.model.entity.Attribute;
import com.codemigration.metagraph.model.entity.ClassInfo;
import com.codemigration.metagraph.model.entity.EntityKeys;
import com.codemigration.metagraph.model.entity.EnumInfo;
import com.codemigration.metagraph.model.entity.MethodRef;
import com.codemigration.metagraph.model.entity.ModuleRef;
import com.codemigration.metagraph.model.entity.Provenance;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JavaParser-backed skeleton parser for legacy Java sources.
 */
@Slf4j
@Component
public class JavaSourceParser implements SyntaxParser {

    private final JavaParser parser = new JavaParser(
        new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    @Override
    public boolean supports(String language) {
        return "java".equals(language);
    }

    @Override
    public ParsedSkeleton parse(SourceUnit unit) {
        ParseResult<CompilationUnit> result = parser.parse(unit.contents());
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            int line = result.getProblems().stream()
                .findFirst()
                .flatMap(p -> p.getLocation())
                .flatMap(l -> l.getBegin().getRange())
                .map(r -> r.begin.line)
                .orElse(0);
            String message = result.getProblems().isEmpty() ? "unparseable compilation unit"
                : result.getProblems().get(0).getVerboseMessage();
            throw new MalformedInputException(unit.path(), line, message);
        }
        CompilationUnit cu = result.getResult().get();
        ParsedSkeleton.ParsedSkeletonBuilder skeleton = ParsedSkeleton.builder();

        Set<String> declared = new LinkedHashSet<>();
        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            String name = qualifiedName(type);
            declared.add(type.getNameAsString());
            if (type instanceof EnumDeclaration enumDecl) {
                skeleton.enumInfo(buildEnum(unit, enumDecl, name));
            } else {
                skeleton.classInfo(buildClass(unit, type, name));
            }
        }

        Map<String, ModuleRef> importsBySimpleName = new LinkedHashMap<>();
        for (ImportDeclaration imp : cu.getImports()) {
            ModuleRef ref = importRef(imp);
            skeleton.importRef(ref);
            if (!imp.isAsterisk()) {
                String simple = imp.isStatic() ? simpleName(ref.getModule()) : imp.getName().getIdentifier();
                importsBySimpleName.putIfAbsent(simple, ref);
            }
        }

        String directory = unit.directory();
        Set<String> usedTypes = cu.findAll(ClassOrInterfaceType.class).stream()
            .map(ClassOrInterfaceType::getNameAsString)
            .filter(n -> !declared.contains(n))
            .collect(Collectors.toCollection(LinkedHashSet::new));
        for (String used : usedTypes) {
            ModuleRef imported = importsBySimpleName.get(used);
            if (imported != null) {
                skeleton.reference(imported);
            } else if (Character.isUpperCase(used.charAt(0))) {
                String candidate = directory.isEmpty() ? used + ".java" : directory + "/" + used + ".java";
                skeleton.reference(ModuleRef.builder().module(used).candidate(candidate).name(used).build());
            }
        }

        ParsedSkeleton parsed = skeleton.build();
        log.debug("Parsed {}: {} classes, {} enums, {} imports", unit.path(),
            parsed.getClasses().size(), parsed.getEnums().size(), parsed.getImports().size());
        return parsed;
    }

    private ClassInfo buildClass(SourceUnit unit, TypeDeclaration<?> type, String name) {
        List<String> superclasses = new ArrayList<>();
        List<String> interfaces = new ArrayList<>();
        String kind = ClassInfo.KIND_PLAIN;
        boolean isFinal = type.hasModifier(Modifier.Keyword.FINAL);

        if (type instanceof ClassOrInterfaceDeclaration cls) {
            if (cls.isInterface()) {
                kind = ClassInfo.KIND_INTERFACE;
                cls.getExtendedTypes().forEach(t -> interfaces.add(t.getNameAsString()));
            } else {
                cls.getExtendedTypes().forEach(t -> superclasses.add(t.getNameAsString()));
                cls.getImplementedTypes().forEach(t -> interfaces.add(t.getNameAsString()));
                if (isSingleton(cls)) {
                    kind = ClassInfo.KIND_SINGLETON;
                } else if (cls.isAbstract()) {
                    kind = ClassInfo.KIND_ABSTRACT;
                }
            }
        } else if (type instanceof RecordDeclaration record) {
            kind = "record";
            isFinal = true;
            record.getImplementedTypes().forEach(t -> interfaces.add(t.getNameAsString()));
        } else if (type instanceof AnnotationDeclaration) {
            kind = "annotation";
        }

        ClassInfo.ClassInfoBuilder builder = ClassInfo.builder()
            .key(EntityKeys.clazz(unit.path(), name))
            .filePath(unit.path())
            .name(name)
            .kind(kind)
            .isStatic(type.hasModifier(Modifier.Keyword.STATIC))
            .isFinal(isFinal)
            .superclasses(superclasses)
            .interfaces(interfaces)
            .methods(type.getMethods().stream().map(this::method).toList())
            .attributes(attributes(type))
            .decorators(annotations(type.getAnnotations()))
            .docstring(javadoc(type))
            .line(line(type));
        for (String field : List.of("name", "type", "is_static", "is_final", "superclasses", "interfaces",
            "methods", "attributes", "decorators", "docstring")) {
            builder.provenanceEntry(field, Provenance.SYNTAX);
        }
        return builder.build();
    }

    /**
     * Private constructors only, plus a static field of the class's own type.
     */
    private boolean isSingleton(ClassOrInterfaceDeclaration cls) {
        boolean privateConstructors = !cls.getConstructors().isEmpty()
            && cls.getConstructors().stream().allMatch(CallableDeclaration::isPrivate);
        boolean selfInstance = cls.getFields().stream()
            .filter(FieldDeclaration::isStatic)
            .anyMatch(f -> f.getElementType().asString().equals(cls.getNameAsString()));
        return privateConstructors && selfInstance;
    }

    private EnumInfo buildEnum(SourceUnit unit, EnumDeclaration enumDecl, String name) {
        return EnumInfo.builder()
            .key(EntityKeys.enumeration(unit.path(), name))
            .filePath(unit.path())
            .name(name)
            .values(enumDecl.getEntries().stream().map(e -> e.getNameAsString()).toList())
            .docstring(javadoc(enumDecl))
            .line(line(enumDecl))
            .provenanceEntry("values", Provenance.SYNTAX)
            .provenanceEntry("docstring", Provenance.SYNTAX)
            .build();
    }

    private MethodRef method(MethodDeclaration method) {
        return MethodRef.builder()
            .name(method.getNameAsString())
            .returnType(method.getTypeAsString())
            .arguments(method.getParameters().stream()
                .map(p -> Argument.of(p.getNameAsString(), p.getTypeAsString()))
                .toList())
            .decorators(annotations(method.getAnnotations()))
            .isStatic(method.isStatic())
            .isAsync(method.getTypeAsString().startsWith("CompletableFuture")
                || method.getTypeAsString().startsWith("Future"))
            .docstring(javadoc(method))
            .build();
    }

    private List<Attribute> attributes(TypeDeclaration<?> type) {
        List<Attribute> attributes = new ArrayList<>();
        for (FieldDeclaration field : type.getFields()) {
            String visibility = field.isPrivate() ? "private"
                : field.isProtected() ? "protected"
                : field.isPublic() ? "public" : "package";
            field.getVariables().forEach(v -> attributes.add(Attribute.builder()
                .name(v.getNameAsString())
                .type(v.getTypeAsString())
                .visibility(visibility)
                .build()));
        }
        return attributes;
    }

    private ModuleRef importRef(ImportDeclaration imp) {
        String name = imp.getNameAsString();
        ModuleRef.ModuleRefBuilder ref = ModuleRef.builder();
        if (imp.isAsterisk()) {
            ref.module(name + ".*");
            if (!imp.isStatic()) {
                ref.candidate(name.replace('.', '/') + "/");
            } else {
                ref.candidate(name.replace('.', '/') + ".java");
            }
            return ref.build();
        }
        String typeName = imp.isStatic() ? name.substring(0, Math.max(name.lastIndexOf('.'), 0)) : name;
        ref.module(name);
        ref.name(simpleName(name));
        if (!typeName.isEmpty()) {
            ref.candidate(typeName.replace('.', '/') + ".java");
        }
        return ref.build();
    }

    private static String qualifiedName(TypeDeclaration<?> type) {
        List<String> names = new ArrayList<>();
        Node current = type;
        while (current != null) {
            if (current instanceof TypeDeclaration<?> declaration) {
                names.add(0, declaration.getNameAsString());
            }
            current = current.getParentNode().orElse(null);
        }
        return String.join(".", names);
    }

    private static String simpleName(String dotted) {
        return dotted.substring(dotted.lastIndexOf('.') + 1);
    }

    private static List<String> annotations(List<AnnotationExpr> annotations) {
        return annotations.stream().map(a -> "@" + a.getNameAsString()).toList();
    }

    private static String javadoc(NodeWithJavadoc<?> node) {
        return node.getJavadoc().map(j -> j.getDescription().toText().strip()).orElse("");
    }

    private static int line(Node node) {
        return node.getBegin().map(p -> p.line).orElse(0);
    }
}
