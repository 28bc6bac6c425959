package com.codemigration.metagraph.extraction.parser;

import com.codemigration.metagraph.exception.MalformedInputException;
import com.codemigration.metagraph.extraction.ParsedSkeleton;
import com.codemigration.metagraph.extraction.SourceUnit;
import com.codemigration.metagraph.extraction.parser.PythonSourceReader.Statement;
import com.codemigration.metagraph.model.entity.Argument;
import com.codemigration.metagraph.model.entity.Attribute;
import com.codemigration.metagraph.model.entity.ClassInfo;
import com.codemigration.metagraph.model.entity.EntityKeys;
import com.codemigration.metagraph.model.entity.EnumInfo;
import com.codemigration.metagraph.model.entity.ExtensionInfo;
import com.codemigration.metagraph.model.entity.FunctionInfo;
import com.codemigration.metagraph.model.entity.MethodRef;
import com.codemigration.metagraph.model.entity.ModuleRef;
import com.codemigration.metagraph.model.entity.Provenance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Skeleton parser for Python: module-level functions, classes (and their nested classes),
 * Enum subclasses, attribute patches on existing types, imports and the module references
 * made through imported names.
 */
@Slf4j
@Component
public class PythonSkeletonParser implements SyntaxParser {

    // Python 3 identifiers: a letter or underscore, then letters, digits, marks and connectors.
    private static final String NAME = "[\\p{L}\\p{Nl}_][\\p{L}\\p{Nl}\\p{Mn}\\p{Mc}\\p{Nd}\\p{Pc}]*";
    private static final int UNICODE = Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern DEF = Pattern.compile("^(async\\s+)?def\\s+(" + NAME + ")\\s*");
    private static final Pattern CLASS = Pattern.compile("^class\\s+(" + NAME + ")\\s*");
    private static final Pattern IMPORT = Pattern.compile("^import\\s+(.+)$", Pattern.DOTALL);
    private static final Pattern FROM_IMPORT = Pattern.compile("^from\\s+(\\.*)([\\w.]*)\\s+import\\s+(.+)$", Pattern.DOTALL | UNICODE);
    private static final Pattern MODULE_NAME = Pattern.compile("[\\w.]+", UNICODE);
    private static final Pattern STRING_LITERAL = Pattern.compile("^[rRuUbBfF]{0,2}(\"\"\"|'''|\"|')(.*)\\1$", Pattern.DOTALL);
    private static final Pattern ANNOTATED = Pattern.compile("^(" + NAME + ")\\s*:\\s*([^=]+?)\\s*(?:=(.*))?$", Pattern.DOTALL);
    private static final Pattern ASSIGNED = Pattern.compile("^(" + NAME + ")\\s*=(?!=)\\s*(.+)$", Pattern.DOTALL);
    private static final Pattern SELF_ATTRIBUTE = Pattern.compile("^self\\.(" + NAME + ")\\s*(?::\\s*([^=]+?))?\\s*=(?!=)\\s*(.+)$", Pattern.DOTALL);
    private static final Pattern PATCH = Pattern.compile("^(" + NAME + ")\\.(" + NAME + ")\\s*=(?!=)\\s*(.+)$", Pattern.DOTALL);
    private static final Pattern SETATTR = Pattern.compile("^setattr\\(\\s*(" + NAME + ")\\s*,\\s*['\"](\\w+)['\"]\\s*,\\s*(.+)\\)$", Pattern.DOTALL | UNICODE);
    private static final Pattern LAMBDA = Pattern.compile("^lambda\\s*([^:]*):.*$", Pattern.DOTALL);

    private static final Set<String> ENUM_BASES = Set.of("Enum", "IntEnum", "StrEnum", "Flag", "IntFlag");
    private static final Set<String> INTERFACE_BASES = Set.of("Protocol");
    private static final Set<String> KNOWN_CLASS_DECORATORS = Set.of("dataclass", "total_ordering", "final",
        "singleton", "runtime_checkable", "unique");
    private static final Set<String> STATIC_DECORATORS = Set.of("staticmethod", "classmethod");
    private static final Set<String> BLOCK_KEYWORDS = Set.of("if", "elif", "else", "try", "except", "finally",
        "with", "for", "while");

    @Override
    public boolean supports(String language) {
        return "python".equals(language);
    }

    @Override
    public ParsedSkeleton parse(SourceUnit unit) {
        List<Statement> module = PythonSourceReader.read(unit.path(), unit.contents());
        ModuleScope scope = new ModuleScope(unit);
        scope.walk(module);
        ParsedSkeleton skeleton = scope.finish(module);
        log.debug("Parsed {}: {} functions, {} classes, {} enums, {} imports", unit.path(),
            skeleton.getFunctions().size(), skeleton.getClasses().size(), skeleton.getEnums().size(),
            skeleton.getImports().size());
        return skeleton;
    }

    /**
     * Mutable state of one module walk.
     */
    private static final class ModuleScope {
        private final SourceUnit unit;
        private final ParsedSkeleton.ParsedSkeletonBuilder skeleton = ParsedSkeleton.builder();
        private final Map<String, ModuleRef> bindings = new LinkedHashMap<>();
        private final Map<String, Integer> functionOrdinals = new HashMap<>();
        private final Map<String, FunctionInfo> functionsByName = new HashMap<>();
        private final Map<String, List<MethodRef>> patches = new LinkedHashMap<>();
        private final Map<String, Integer> patchLines = new HashMap<>();
        private final Set<Statement> importStatements = new LinkedHashSet<>();

        ModuleScope(SourceUnit unit) {
            this.unit = unit;
        }

        void walk(List<Statement> statements) {
            List<String> decorators = new ArrayList<>();
            for (Statement statement : statements) {
                String text = statement.text;
                if (text.startsWith("@")) {
                    decorators.add(text.substring(1).strip());
                    continue;
                }
                if (isDef(text)) {
                    FunctionInfo function = function(statement, decorators);
                    skeleton.function(function);
                    functionsByName.put(function.getName(), function);
                } else if (text.startsWith("class ") || text.startsWith("class\t")) {
                    declareClass(statement, decorators, null);
                } else if (text.startsWith("import ") || text.startsWith("from ")) {
                    importStatement(statement);
                } else if (BLOCK_KEYWORDS.contains(firstWord(text)) && statement.opensBlock()) {
                    walk(statement.body);
                } else {
                    patch(statement);
                }
                decorators.clear();
            }
        }

        ParsedSkeleton finish(List<Statement> module) {
            patches.forEach((base, methods) -> skeleton.extension(ExtensionInfo.builder()
                .key(EntityKeys.extension(unit.path(), base))
                .filePath(unit.path())
                .name(base)
                .baseType(base)
                .methods(methods)
                .line(patchLines.getOrDefault(base, 0))
                .provenanceEntry("base_type", Provenance.SYNTAX)
                .provenanceEntry("methods", Provenance.SYNTAX)
                .build()));

            String code = codeText(module);
            Set<ModuleRef> referenced = new LinkedHashSet<>();
            bindings.forEach((alias, ref) -> {
                if (Pattern.compile("(?<![\\w.])" + Pattern.quote(alias) + "(?!\\w)", UNICODE).matcher(code).find()) {
                    referenced.add(ref);
                }
            });
            referenced.forEach(skeleton::reference);
            return skeleton.build();
        }

        // ================================================================
        // Functions
        // ================================================================

        private FunctionInfo function(Statement statement, List<String> decorators) {
            Signature signature = signature(statement);
            int ordinal = functionOrdinals.merge(signature.name(), 1, Integer::sum) - 1;
            FunctionInfo.FunctionInfoBuilder builder = FunctionInfo.builder()
                .key(EntityKeys.function(unit.path(), signature.name(), ordinal))
                .filePath(unit.path())
                .name(signature.name())
                .returnType(signature.returnType() == null ? "Any" : signature.returnType())
                .arguments(signature.arguments())
                .decorators(decorators)
                .isStatic(true)
                .isAsync(signature.async())
                .docstring(docstring(statement.body))
                .line(statement.line);
            for (String field : List.of("name", "arguments", "decorators", "is_static", "is_async", "docstring")) {
                builder.provenanceEntry(field, Provenance.SYNTAX);
            }
            if (signature.returnType() == null) {
                builder.unresolvedField("return_type");
            } else {
                builder.provenanceEntry("return_type", Provenance.SYNTAX);
            }
            return builder.build();
        }

        private Signature signature(Statement statement) {
            String text = statement.text;
            Matcher m = DEF.matcher(text);
            if (!m.lookingAt()) {
                throw new MalformedInputException(unit.path(), statement.line, "invalid function definition");
            }
            int open = m.end();
            if (open < text.length() && text.charAt(open) == '[') {
                int typeParameters = PythonSourceReader.matchingClose(text, open);
                if (typeParameters < 0) {
                    throw new MalformedInputException(unit.path(), statement.line, "unclosed type parameter list");
                }
                open = typeParameters + 1;
                while (open < text.length() && Character.isWhitespace(text.charAt(open))) {
                    open++;
                }
            }
            if (open >= text.length() || text.charAt(open) != '(') {
                throw new MalformedInputException(unit.path(), statement.line, "invalid function definition");
            }
            int close = PythonSourceReader.matchingClose(text, open);
            if (close < 0) {
                throw new MalformedInputException(unit.path(), statement.line, "unclosed parameter list");
            }
            String rest = text.substring(close + 1).strip();
            String returnType = null;
            if (rest.startsWith("->")) {
                int colon = PythonSourceReader.indexOfTopLevel(rest, ':', 2);
                if (colon < 0) {
                    throw new MalformedInputException(unit.path(), statement.line, "expected ':' after return annotation");
                }
                returnType = rest.substring(2, colon).strip();
                if (returnType.isEmpty()) {
                    throw new MalformedInputException(unit.path(), statement.line, "empty return annotation");
                }
            } else if (!rest.startsWith(":")) {
                throw new MalformedInputException(unit.path(), statement.line, "expected ':' after parameter list");
            }
            return new Signature(m.group(2), m.group(1) != null, arguments(text.substring(open + 1, close)), returnType);
        }

        private List<Argument> arguments(String parameterList) {
            List<Argument> arguments = new ArrayList<>();
            for (String parameter : PythonSourceReader.splitTopLevel(parameterList, ',')) {
                if (parameter.equals("/") || parameter.equals("*")) {
                    continue;
                }
                int equals = PythonSourceReader.indexOfTopLevel(parameter, '=', 0);
                String head = equals < 0 ? parameter : parameter.substring(0, equals).strip();
                int colon = PythonSourceReader.indexOfTopLevel(head, ':', 0);
                String name = colon < 0 ? head : head.substring(0, colon).strip();
                String type = colon < 0 ? "Any" : head.substring(colon + 1).strip();
                arguments.add(Argument.of(name, type.isEmpty() ? "Any" : type));
            }
            return arguments;
        }

        private MethodRef method(Statement statement, List<String> decorators) {
            Signature signature = signature(statement);
            boolean isStatic = decorators.stream().map(PythonSkeletonParser::decoratorName).anyMatch(STATIC_DECORATORS::contains);
            List<Argument> arguments = new ArrayList<>(signature.arguments());
            boolean staticMethod = decorators.stream().map(PythonSkeletonParser::decoratorName).anyMatch("staticmethod"::equals);
            if (!staticMethod && !arguments.isEmpty()
                && (arguments.get(0).getName().equals("self") || arguments.get(0).getName().equals("cls"))) {
                arguments.remove(0);
            }
            return MethodRef.builder()
                .name(signature.name())
                .returnType(signature.returnType() == null ? "Any" : signature.returnType())
                .arguments(arguments)
                .decorators(decorators)
                .isStatic(isStatic)
                .isAsync(signature.async())
                .docstring(docstring(statement.body))
                .build();
        }

        // ================================================================
        // Classes and enums
        // ================================================================

        private void declareClass(Statement statement, List<String> decorators, String outer) {
            String text = statement.text;
            Matcher m = CLASS.matcher(text);
            if (!m.lookingAt()) {
                throw new MalformedInputException(unit.path(), statement.line, "invalid class definition");
            }
            String name = outer == null ? m.group(1) : outer + "." + m.group(1);
            List<String> bases = new ArrayList<>();
            String metaclass = null;
            int after = m.end();
            if (after < text.length() && text.charAt(after) == '[') {
                after = PythonSourceReader.matchingClose(text, after) + 1;
                if (after == 0) {
                    throw new MalformedInputException(unit.path(), statement.line, "unclosed type parameter list");
                }
            }
            if (after < text.length() && text.charAt(after) == '(') {
                int close = PythonSourceReader.matchingClose(text, after);
                if (close < 0) {
                    throw new MalformedInputException(unit.path(), statement.line, "unclosed base list");
                }
                for (String base : PythonSourceReader.splitTopLevel(text.substring(after + 1, close), ',')) {
                    if (base.startsWith("metaclass")) {
                        metaclass = base.substring(base.indexOf('=') + 1).strip();
                    } else if (!base.contains("=") && !base.startsWith("*")) {
                        bases.add(base);
                    }
                }
                after = close + 1;
            }
            if (!text.substring(after).strip().startsWith(":")) {
                throw new MalformedInputException(unit.path(), statement.line, "expected ':' after class header");
            }

            if (bases.stream().map(PythonSkeletonParser::lastSegment).anyMatch(ENUM_BASES::contains)) {
                skeleton.enumInfo(enumeration(statement, name));
                return;
            }

            ClassShape shape = new ClassShape();
            List<String> pending = new ArrayList<>();
            for (Statement member : statement.body) {
                String memberText = member.text;
                if (memberText.startsWith("@")) {
                    pending.add(memberText.substring(1).strip());
                    continue;
                }
                if (isDef(memberText)) {
                    MethodRef method = method(member, pending);
                    shape.methods.add(method);
                    if (method.getName().equals("__init__")) {
                        collectInstanceAttributes(member.body, shape);
                    }
                    if (method.getName().equals("__new__") && mentionsInstance(member)) {
                        shape.singletonHint = true;
                    }
                    if (pending.stream().map(PythonSkeletonParser::decoratorName).anyMatch("abstractmethod"::equals)) {
                        shape.abstractMethod = true;
                    }
                } else if (memberText.startsWith("class ")) {
                    declareClass(member, pending, name);
                } else {
                    classAttribute(memberText, shape);
                }
                pending.clear();
            }

            List<String> superclasses = new ArrayList<>();
            List<String> interfaces = new ArrayList<>();
            for (String base : bases) {
                String simple = lastSegment(base);
                if (INTERFACE_BASES.contains(simple) || simple.startsWith("Protocol[")) {
                    interfaces.add(base);
                } else {
                    superclasses.add(base);
                }
            }

            Set<String> decoratorNames = new LinkedHashSet<>();
            decorators.forEach(d -> decoratorNames.add(decoratorName(d)));
            boolean unknownDecorator = decoratorNames.stream().anyMatch(d -> !KNOWN_CLASS_DECORATORS.contains(d));
            boolean unknownMetaclass = metaclass != null && !lastSegment(metaclass).equals("ABCMeta")
                && !metaclass.contains("Singleton") && !metaclass.equals("type");

            String kind = classKind(shape, bases, metaclass, decoratorNames);
            ClassInfo.ClassInfoBuilder builder = ClassInfo.builder()
                .key(EntityKeys.clazz(unit.path(), name))
                .filePath(unit.path())
                .name(name)
                .kind(kind)
                .isStatic(outer != null)
                .isFinal(decoratorNames.contains("final"))
                .superclasses(superclasses)
                .interfaces(interfaces)
                .methods(shape.methods)
                .attributes(new ArrayList<>(shape.attributes.values()))
                .decorators(decorators)
                .docstring(docstring(statement.body))
                .line(statement.line);
            for (String field : List.of("name", "is_static", "is_final", "superclasses", "interfaces", "methods",
                "attributes", "decorators", "docstring")) {
                builder.provenanceEntry(field, Provenance.SYNTAX);
            }
            if (unknownDecorator || unknownMetaclass) {
                builder.unresolvedField("type");
            } else {
                builder.provenanceEntry("type", Provenance.SYNTAX);
            }
            skeleton.classInfo(builder.build());
        }

        private String classKind(ClassShape shape, List<String> bases, String metaclass, Set<String> decorators) {
            boolean protocol = bases.stream().map(PythonSkeletonParser::lastSegment)
                .anyMatch(b -> b.equals("Protocol") || b.startsWith("Protocol["));
            boolean abc = bases.stream().map(PythonSkeletonParser::lastSegment).anyMatch("ABC"::equals)
                || (metaclass != null && lastSegment(metaclass).equals("ABCMeta"))
                || shape.abstractMethod;
            boolean singleton = shape.singletonHint
                || shape.attributes.containsKey("_instance")
                || decorators.contains("singleton")
                || (metaclass != null && metaclass.contains("Singleton"));
            if (singleton) {
                return ClassInfo.KIND_SINGLETON;
            }
            if (protocol) {
                return ClassInfo.KIND_INTERFACE;
            }
            if (abc) {
                return ClassInfo.KIND_ABSTRACT;
            }
            if (decorators.contains("dataclass")) {
                return "dataclass";
            }
            return ClassInfo.KIND_PLAIN;
        }

        private void classAttribute(String text, ClassShape shape) {
            Matcher annotated = ANNOTATED.matcher(text);
            if (annotated.matches()) {
                String name = annotated.group(1);
                shape.attributes.put(name, attribute(name, annotated.group(2).strip()));
                return;
            }
            Matcher assigned = ASSIGNED.matcher(text);
            if (assigned.matches()) {
                String name = assigned.group(1);
                shape.attributes.putIfAbsent(name, attribute(name, literalType(assigned.group(2))));
            }
        }

        private void collectInstanceAttributes(List<Statement> body, ClassShape shape) {
            for (Statement statement : body) {
                Matcher m = SELF_ATTRIBUTE.matcher(statement.text);
                if (m.matches()) {
                    String type = m.group(2) != null ? m.group(2).strip() : literalType(m.group(3));
                    shape.attributes.putIfAbsent(m.group(1), attribute(m.group(1), type));
                }
                collectInstanceAttributes(statement.body, shape);
            }
        }

        private boolean mentionsInstance(Statement statement) {
            if (statement.text.contains("_instance")) {
                return true;
            }
            return statement.body.stream().anyMatch(this::mentionsInstance);
        }

        private EnumInfo enumeration(Statement statement, String name) {
            List<String> values = new ArrayList<>();
            for (Statement member : statement.body) {
                Matcher assigned = ASSIGNED.matcher(member.text);
                Matcher annotated = ANNOTATED.matcher(member.text);
                String valueName = assigned.matches() ? assigned.group(1)
                    : annotated.matches() && annotated.group(3) != null ? annotated.group(1) : null;
                if (valueName != null && !valueName.startsWith("_")) {
                    values.add(valueName);
                }
            }
            return EnumInfo.builder()
                .key(EntityKeys.enumeration(unit.path(), name))
                .filePath(unit.path())
                .name(name)
                .values(values)
                .docstring(docstring(statement.body))
                .line(statement.line)
                .provenanceEntry("values", Provenance.SYNTAX)
                .provenanceEntry("docstring", Provenance.SYNTAX)
                .build();
        }

        // ================================================================
        // Imports and patches
        // ================================================================

        private void importStatement(Statement statement) {
            importStatements.add(statement);
            String text = statement.text;
            Matcher from = FROM_IMPORT.matcher(text);
            if (from.matches()) {
                int level = from.group(1).length();
                String module = from.group(2);
                String names = from.group(3).strip();
                if (names.startsWith("(") && names.endsWith(")")) {
                    names = names.substring(1, names.length() - 1);
                }
                List<String> base = level == 0 ? List.of() : packageOf(level);
                String written = ".".repeat(level) + module;
                for (String item : PythonSourceReader.splitTopLevel(names, ',')) {
                    String[] parts = item.split("\\s+as\\s+");
                    String imported = parts[0].strip();
                    String alias = parts.length > 1 ? parts[1].strip() : imported;
                    ModuleRef.ModuleRefBuilder ref = ModuleRef.builder().module(written.isEmpty() ? "." : written);
                    if (base != null) {
                        List<String> moduleParts = join(base, module);
                        if (!imported.equals("*")) {
                            ref.name(imported);
                            List<String> submodule = new ArrayList<>(moduleParts);
                            submodule.add(imported);
                            addModuleCandidates(ref, submodule);
                        }
                        if (!moduleParts.isEmpty()) {
                            addModuleCandidates(ref, moduleParts);
                        }
                    }
                    ModuleRef built = ref.build();
                    skeleton.importRef(built);
                    if (!imported.equals("*")) {
                        bindings.put(alias, built);
                    }
                }
                return;
            }
            Matcher plain = IMPORT.matcher(text);
            if (!plain.matches()) {
                throw new MalformedInputException(unit.path(), statement.line, "invalid import statement");
            }
            for (String item : PythonSourceReader.splitTopLevel(plain.group(1), ',')) {
                String[] parts = item.split("\\s+as\\s+");
                String module = parts[0].strip();
                if (!MODULE_NAME.matcher(module).matches()) {
                    throw new MalformedInputException(unit.path(), statement.line, "invalid module name '" + module + "'");
                }
                ModuleRef.ModuleRefBuilder ref = ModuleRef.builder().module(module);
                addModuleCandidates(ref, Arrays.asList(module.split("\\.")));
                ModuleRef built = ref.build();
                skeleton.importRef(built);
                String alias = parts.length > 1 ? parts[1].strip() : module.split("\\.")[0];
                bindings.putIfAbsent(alias, built);
            }
        }

        /**
         * Package path {@code level} dots refer to, or {@code null} when it escapes the project root.
         */
        private List<String> packageOf(int level) {
            List<String> parts = new ArrayList<>();
            String directory = unit.directory();
            if (!directory.isEmpty()) {
                parts.addAll(Arrays.asList(directory.split("/")));
            }
            for (int i = 1; i < level; i++) {
                if (parts.isEmpty()) {
                    return null;
                }
                parts.remove(parts.size() - 1);
            }
            return parts;
        }

        private void patch(Statement statement) {
            String text = statement.text;
            String base;
            String attribute;
            String value;
            Matcher m = PATCH.matcher(text);
            Matcher s = SETATTR.matcher(text);
            if (m.matches()) {
                base = m.group(1);
                attribute = m.group(2);
                value = m.group(3).strip();
            } else if (s.matches()) {
                base = s.group(1);
                attribute = s.group(2);
                value = s.group(3).strip();
            } else {
                return;
            }
            if (base.equals("self") || base.equals("cls")) {
                return;
            }
            MethodRef method;
            Matcher lambda = LAMBDA.matcher(value);
            if (lambda.matches()) {
                method = MethodRef.builder().name(attribute).returnType("Any")
                    .arguments(arguments(lambda.group(1))).build();
            } else if (functionsByName.containsKey(value)) {
                FunctionInfo function = functionsByName.get(value);
                method = MethodRef.builder().name(attribute).returnType(function.getReturnType())
                    .arguments(function.getArguments()).decorators(function.getDecorators())
                    .isAsync(function.isAsync()).docstring(function.getDocstring()).build();
            } else {
                return;
            }
            patches.computeIfAbsent(base, b -> new ArrayList<>()).add(method);
            patchLines.putIfAbsent(base, statement.line);
        }

        private String codeText(List<Statement> statements) {
            StringBuilder code = new StringBuilder();
            for (Statement statement : statements) {
                if (!importStatements.contains(statement)) {
                    code.append(statement.text).append('\n');
                }
                code.append(codeText(statement.body));
            }
            return code.toString();
        }
    }

    private record Signature(String name, boolean async, List<Argument> arguments, String returnType) {
    }

    private static final class ClassShape {
        final List<MethodRef> methods = new ArrayList<>();
        final Map<String, Attribute> attributes = new LinkedHashMap<>();
        boolean singletonHint;
        boolean abstractMethod;
    }

    // ================================================================
    // Helpers
    // ================================================================

    private static void addModuleCandidates(ModuleRef.ModuleRefBuilder ref, List<String> parts) {
        String path = String.join("/", parts);
        ref.candidate(path + ".py");
        ref.candidate(path + "/__init__.py");
    }

    private static List<String> join(List<String> base, String module) {
        List<String> parts = new ArrayList<>(base);
        if (!module.isEmpty()) {
            parts.addAll(Arrays.asList(module.split("\\.")));
        }
        return parts;
    }

    private static Attribute attribute(String name, String type) {
        String visibility;
        if (name.startsWith("__") && !name.endsWith("__")) {
            visibility = "private";
        } else if (name.startsWith("_")) {
            visibility = "protected";
        } else {
            visibility = "public";
        }
        return Attribute.builder().name(name).type(type).visibility(visibility).build();
    }

    static String literalType(String value) {
        String v = value.strip();
        if (v.matches("-?\\d+")) {
            return "int";
        }
        if (v.matches("-?\\d*\\.\\d+([eE][-+]?\\d+)?")) {
            return "float";
        }
        if (v.equals("True") || v.equals("False")) {
            return "bool";
        }
        if (STRING_LITERAL.matcher(v).matches()) {
            return "str";
        }
        if (v.startsWith("[")) {
            return "list";
        }
        if (v.startsWith("{")) {
            return v.equals("{}") || PythonSourceReader.indexOfTopLevel(v.substring(1), ':', 0) >= 0 ? "dict" : "set";
        }
        if (v.startsWith("(")) {
            return "tuple";
        }
        return "Any";
    }

    static String decoratorName(String decorator) {
        int paren = decorator.indexOf('(');
        return lastSegment(paren < 0 ? decorator : decorator.substring(0, paren)).strip();
    }

    static String lastSegment(String dotted) {
        int dot = dotted.lastIndexOf('.');
        return dot < 0 ? dotted.strip() : dotted.substring(dot + 1).strip();
    }

    private static boolean isDef(String text) {
        return text.startsWith("def ") || text.startsWith("async def ") || DEF.matcher(text).lookingAt();
    }

    private static String firstWord(String text) {
        int end = 0;
        while (end < text.length() && Character.isLetter(text.charAt(end))) {
            end++;
        }
        return text.substring(0, end);
    }

    private static String docstring(List<Statement> body) {
        if (body.isEmpty()) {
            return "";
        }
        Matcher m = STRING_LITERAL.matcher(body.get(0).text);
        return m.matches() ? m.group(2).strip() : "";
    }
}
