package net.seitter.sqlshell.completion;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Keywords and built-in function names of the SQL dialect understood by the shell.
 */
public final class SqlKeywords {

    // Reserved words and statement keywords
    public static final List<String> KEYWORDS = Collections.unmodifiableList(Arrays.asList(
        "ALL", "ALTER", "AND", "ANY", "ARRAY", "AS", "ASC", "ATTACH", "BETWEEN", "BIGINT",
        "BOOLEAN", "BOTH", "BY", "CASCADE", "CASE", "CAST", "CHAR", "COPY", "CREATE",
        "CROSS", "CURRENT_DATE", "DATABASE", "DATE", "DATETIME", "DECIMAL", "DEFAULT",
        "DELETE", "DESC", "DESCRIBE", "DIMENSION", "DISTINCT", "DOUBLE", "DROP", "ELSE",
        "END", "ENGINE", "EXCEPT", "EXECUTE", "EXISTS", "EXPLAIN", "EXTERNAL", "EXTRACT",
        "FACT", "FALSE", "FETCH", "FIRST", "FLOAT", "FOR", "FROM", "FULL", "GENERATE",
        "GROUP", "HAVING", "IF", "ILIKE", "IN", "INDEX", "INNER", "INSERT", "INT",
        "INTEGER", "INTERSECT", "INTERVAL", "INTO", "IS", "JOIN", "JOIN_INDEX", "KEY",
        "LAST", "LEADING", "LEFT", "LIKE", "LIMIT", "LONG", "NATURAL", "NEXT", "NOT",
        "NULL", "NULLS", "OFFSET", "ON", "OR", "ORDER", "OUTER", "OVER", "PARTITION",
        "PRECISION", "PRIMARY", "QUALIFY", "REAL", "RIGHT", "ROW", "ROWS", "SAMPLE",
        "SELECT", "SET", "SHOW", "SOME", "START", "STOP", "TABLE", "TABLES", "TEXT",
        "THEN", "TIMESTAMP", "TO", "TOP", "TRAILING", "TRUE", "TRUNCATE", "UNION",
        "UNKNOWN_CHAR", "UNNEST", "UPDATE", "USE", "USING", "VARCHAR", "VIEW", "WHEN",
        "WHERE", "WITH"
    ));

    // Built-in scalar, aggregate and window functions
    public static final List<String> FUNCTIONS = Collections.unmodifiableList(Arrays.asList(
        "ABS", "ACOS", "AGO", "ANY_VALUE", "APPROX_PERCENTILE", "ARRAY_CONCAT",
        "ARRAY_COUNT", "ARRAY_DISTINCT", "ARRAY_JOIN", "ARRAY_MAX", "ARRAY_MIN",
        "ARRAY_SORT", "ARRAY_SUM", "ARRAY_UNIQUE", "ASIN", "ATAN", "ATAN2", "AVG",
        "BASE64_ENCODE", "BIT_AND", "BIT_OR", "BIT_XOR", "BTRIM", "CBRT", "CEIL",
        "CEILING", "CHECKSUM", "COALESCE", "CONCAT", "CONTAINS", "COS", "COT", "COUNT",
        "DATE_ADD", "DATE_DIFF", "DATE_FORMAT", "DATE_TRUNC", "DEGREES", "DENSE_RANK",
        "EXP", "FILTER", "FIRST_VALUE", "FLATTEN", "FLOOR", "FROM_UNIXTIME", "GEN_RANDOM_UUID",
        "GREATEST", "HASH", "HASH_AGG", "IFNULL", "INDEX_OF", "JSON_EXTRACT",
        "JSON_EXTRACT_ARRAY_RAW", "JSON_EXTRACT_KEYS", "JSON_EXTRACT_RAW",
        "JSON_EXTRACT_VALUES", "LAG", "LAST_VALUE", "LEAD", "LEAST", "LENGTH", "LN",
        "LOG", "LOWER", "LPAD", "LTRIM", "MATCH", "MATCH_ANY", "MAX", "MAX_BY", "MD5",
        "MEDIAN", "MIN", "MIN_BY", "MOD", "NOW", "NTH_VALUE", "NULLIF", "NVL", "PI",
        "POW", "POWER", "RADIANS", "RANDOM", "RANK", "REGEXP_LIKE", "REGEXP_MATCHES",
        "REGEXP_REPLACE", "REPEAT", "REPLACE", "REVERSE", "ROUND", "ROW_NUMBER", "RPAD",
        "RTRIM", "SIGN", "SIN", "SLICE", "SPLIT", "SPLIT_PART", "SQRT", "STDDEV_SAMP",
        "STRPOS", "SUBSTR", "SUBSTRING", "SUM", "TAN", "TO_CHAR", "TO_DATE", "TO_DOUBLE",
        "TO_FLOAT", "TO_INT", "TO_LONG", "TO_STRING", "TO_TIMESTAMP", "TO_UNIXTIME",
        "TRANSFORM", "TRIM", "TRUNC", "UPPER", "VARIANCE"
    ));

    private SqlKeywords() {
    }
}
