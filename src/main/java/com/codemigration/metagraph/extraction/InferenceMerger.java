package com.codemigration.metagraph.extraction;

import com.codemigration.metagraph.model.entity.ClassInfo;
import com.codemigration.metagraph.model.entity.FunctionInfo;
import com.codemigration.metagraph.model.entity.ModuleRef;
import com.codemigration.metagraph.model.entity.Provenance;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Merges an inferred skeleton into the syntactic one.
 *
 * <p>Inference only fills fields the parser listed as unresolved. When inference disagrees with
 * a field the parser did resolve, the syntactic value stays and the disagreement is appended to
 * the class's {@code provenance_conflicts}.
 */
@Component
public class InferenceMerger {

    public ParsedSkeleton merge(ParsedSkeleton syntactic, ParsedSkeleton inferred) {
        if (syntactic == null) {
            return inferred;
        }
        if (inferred == null) {
            return syntactic;
        }

        Map<String, FunctionInfo> inferredFunctions = byName(inferred.getFunctions(), FunctionInfo::getName);
        Map<String, ClassInfo> inferredClasses = byName(inferred.getClasses(), ClassInfo::getName);

        List<FunctionInfo> functions = new ArrayList<>();
        for (FunctionInfo function : syntactic.getFunctions()) {
            FunctionInfo guess = inferredFunctions.get(function.getName());
            functions.add(guess == null ? function : mergeFunction(function, guess));
        }

        List<ClassInfo> classes = new ArrayList<>();
        for (ClassInfo clazz : syntactic.getClasses()) {
            ClassInfo guess = inferredClasses.get(clazz.getName());
            classes.add(guess == null ? clazz : mergeClass(clazz, guess));
        }

        // imports the parser missed (dynamic imports, string-built module names)
        Set<String> knownModules = syntactic.getImports().stream().map(ModuleRef::getModule)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        List<ModuleRef> imports = new ArrayList<>(syntactic.getImports());
        for (ModuleRef ref : inferred.getImports()) {
            if (knownModules.add(ref.getModule())) {
                imports.add(ref);
            }
        }

        return syntactic.toBuilder()
            .clearFunctions().functions(functions)
            .clearClasses().classes(classes)
            .clearImports().imports(imports)
            .build();
    }

    FunctionInfo mergeFunction(FunctionInfo syntactic, FunctionInfo inferred) {
        if (!syntactic.getUnresolved().contains("return_type")) {
            return syntactic;
        }
        Set<String> unresolved = new LinkedHashSet<>(syntactic.getUnresolved());
        unresolved.remove("return_type");
        return syntactic.toBuilder()
            .returnType(inferred.getReturnType())
            .provenanceEntry("return_type", Provenance.INFERENCE)
            .clearUnresolved().unresolved(unresolved)
            .build();
    }

    ClassInfo mergeClass(ClassInfo syntactic, ClassInfo inferred) {
        ClassInfo.ClassInfoBuilder merged = syntactic.toBuilder();
        String inferredKind = inferred.getKind();

        if (syntactic.getUnresolved().contains("type")) {
            Set<String> unresolved = new LinkedHashSet<>(syntactic.getUnresolved());
            unresolved.remove("type");
            merged.kind(inferredKind)
                .provenanceEntry("type", Provenance.INFERENCE)
                .clearUnresolved().unresolved(unresolved);
        } else if (inferredKind != null && !Objects.equals(syntactic.getKind(), inferredKind)) {
            merged.provenanceConflict(conflict("type", syntactic.getKind(), inferredKind));
        }
        return merged.build();
    }

    private static Map<String, Object> conflict(String field, String syntax, String inference) {
        Map<String, Object> conflict = new LinkedHashMap<>();
        conflict.put("field", field);
        conflict.put("syntax", syntax);
        conflict.put("inference", inference);
        conflict.put("winner", Provenance.SYNTAX.tag());
        return conflict;
    }

    private static <T> Map<String, T> byName(List<T> items, Function<T, String> name) {
        Map<String, T> map = new LinkedHashMap<>();
        for (T item : items) {
            map.putIfAbsent(name.apply(item), item);
        }
        return map;
    }
}
