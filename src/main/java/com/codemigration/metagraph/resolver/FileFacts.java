package com.codemigration.metagraph.resolver;

import java.util.List;

/**
 * What classification looks at for one file.
 *
 * @param classKinds Kind tag of every class declared in the file
 * @param imports Modules the file imports, as written
 */
public record FileFacts(String path, String language, String parseStatus, List<String> functionNames,
                        List<String> classKinds, List<String> classNames, int enums, List<String> imports) {

    public boolean hasEntities() {
        return !functionNames.isEmpty() || !classKinds.isEmpty() || enums > 0;
    }
}
