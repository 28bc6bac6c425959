package com.codemigration.metagraph.model.entity;

/**
 * Natural keys. Every key is unique inside one project; the store scopes it by project id.
 */
public final class EntityKeys {

    private EntityKeys() {
    }

    public static String file(String path) {
        return path;
    }

    /**
     * Function key; {@code ordinal} disambiguates redefinitions of the same name in one file.
     */
    public static String function(String path, String name, int ordinal) {
        return ordinal == 0 ? path + "::fn:" + name : path + "::fn:" + name + "#" + ordinal;
    }

    public static String clazz(String path, String name) {
        return path + "::class:" + name;
    }

    public static String enumeration(String path, String name) {
        return path + "::enum:" + name;
    }

    public static String extension(String path, String name) {
        return path + "::ext:" + name;
    }

    public static String component(String path) {
        return "component:" + path;
    }

    public static String dependency(String name) {
        return "dep:" + name;
    }

    /**
     * Key of a project-internal module that is missing from the upload, by its resolved path.
     */
    public static String internalDependency(String path) {
        return "dep:internal:" + path;
    }

    public static String mapping(String sourceKey) {
        return "mapping:" + sourceKey;
    }

    public static String targetComponent(String name, String version) {
        return "target:" + name + "@" + (version == null ? "latest" : version);
    }

    public static String strategy(String componentKey) {
        return "strategy:" + componentKey;
    }

    /**
     * Key for a report that a stage rewrites on every run rather than appending.
     */
    public static String stageReport(String type, String subject) {
        return "report:" + type + ":" + subject;
    }
}
