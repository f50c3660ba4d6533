package de.burger.typehook.config;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Names the instrumenter emits into rewritten modules: the runtime module star-imported by the
 * preamble and the attributes that import makes available. Defaults are obfuscated enough not to
 * collide with user names; each can be overridden by a system property.
 */
public record RuntimeSymbols(
    String runtimeModule,
    String decoratorName,
    String configTableName,
    String assignmentCheckName,
    String typeAliasHookName
) {

    public static final String RUNTIME_MODULE_PROP = "typehook.runtime.module";
    public static final String DECORATOR_PROP = "typehook.runtime.decorator";
    public static final String CONFIG_TABLE_PROP = "typehook.runtime.configTable";
    public static final String ASSIGNMENT_CHECK_PROP = "typehook.runtime.assignmentCheck";
    public static final String TYPE_ALIAS_HOOK_PROP = "typehook.runtime.typeAliasHook";

    public static final String DEFAULT_RUNTIME_MODULE = "typehook.claw.runtime";
    public static final String DEFAULT_DECORATOR = "__typehook_decorate__";
    public static final String DEFAULT_CONFIG_TABLE = "__typehook_conf__";
    public static final String DEFAULT_ASSIGNMENT_CHECK = "__typehook_check__";
    public static final String DEFAULT_TYPE_ALIAS_HOOK = "__typehook_alias__";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern DOTTED = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*");

    public RuntimeSymbols {
        requireMatching(runtimeModule, DOTTED, "runtimeModule");
        requireMatching(decoratorName, IDENTIFIER, "decoratorName");
        requireMatching(configTableName, IDENTIFIER, "configTableName");
        requireMatching(assignmentCheckName, IDENTIFIER, "assignmentCheckName");
        requireMatching(typeAliasHookName, IDENTIFIER, "typeAliasHookName");
    }

    /** Symbols with the default type alias hook name. */
    public RuntimeSymbols(String runtimeModule, String decoratorName, String configTableName, String assignmentCheckName) {
        this(runtimeModule, decoratorName, configTableName, assignmentCheckName, DEFAULT_TYPE_ALIAS_HOOK);
    }

    public static RuntimeSymbols defaults() {
        return new RuntimeSymbols(DEFAULT_RUNTIME_MODULE, DEFAULT_DECORATOR, DEFAULT_CONFIG_TABLE, DEFAULT_ASSIGNMENT_CHECK,
            DEFAULT_TYPE_ALIAS_HOOK);
    }

    /** Defaults overridden by the {@code typehook.runtime.*} system properties; blank values are ignored. */
    public static RuntimeSymbols fromSystemProperties() {
        return new RuntimeSymbols(
            property(RUNTIME_MODULE_PROP, DEFAULT_RUNTIME_MODULE),
            property(DECORATOR_PROP, DEFAULT_DECORATOR),
            property(CONFIG_TABLE_PROP, DEFAULT_CONFIG_TABLE),
            property(ASSIGNMENT_CHECK_PROP, DEFAULT_ASSIGNMENT_CHECK),
            property(TYPE_ALIAS_HOOK_PROP, DEFAULT_TYPE_ALIAS_HOOK));
    }

    private static String property(String key, String fallback) {
        String value = System.getProperty(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static void requireMatching(String value, Pattern pattern, String field) {
        Objects.requireNonNull(value, field);
        if (!pattern.matcher(value).matches()) {
            throw new IllegalArgumentException(field + " is not a valid name: '" + value + "'");
        }
    }
}
