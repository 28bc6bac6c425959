package com.codemigration.metagraph.extraction;

import com.codemigration.metagraph.model.entity.ClassInfo;
import com.codemigration.metagraph.model.entity.EnumInfo;
import com.codemigration.metagraph.model.entity.ExtensionInfo;
import com.codemigration.metagraph.model.entity.FunctionInfo;
import com.codemigration.metagraph.model.entity.ModuleRef;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Structural skeleton of one file, as produced by a syntax parser or by inference.
 */
@Value
@Builder(toBuilder = true)
public class ParsedSkeleton {

    @Singular
    List<FunctionInfo> functions;
    @Singular("classInfo")
    List<ClassInfo> classes;
    @Singular("enumInfo")
    List<EnumInfo> enums;
    @Singular
    List<ExtensionInfo> extensions;
    @Singular("importRef")
    List<ModuleRef> imports;
    @Singular
    List<ModuleRef> references;

    public static ParsedSkeleton empty() {
        return ParsedSkeleton.builder().build();
    }

    /**
     * True when some entity carries a field the parser could not decide.
     */
    public boolean hasUnresolved() {
        return functions.stream().anyMatch(f -> !f.getUnresolved().isEmpty())
            || classes.stream().anyMatch(c -> !c.getUnresolved().isEmpty());
    }

    public int entityCount() {
        return functions.size() + classes.size() + enums.size() + extensions.size();
    }
}
