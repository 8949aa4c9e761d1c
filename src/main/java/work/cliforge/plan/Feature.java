package work.cliforge.plan;

/**
 * Optional support routines a generated program may need.
 */
public enum Feature {
    ENV_FALLBACK,
    HTTP_STEP,
    JSON_OUTPUT,
    TABLE_OUTPUT,
    TEXT_OUTPUT,
    STEP_PATH,
    ARG_LOOKUP,
    JSON_ENCODE,
    OBJECT_LITERAL,
    /** Derived: anything that needs the shared Jackson mapper. */
    JSON_MAPPER
}
