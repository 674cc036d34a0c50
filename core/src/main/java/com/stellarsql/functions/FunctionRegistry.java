package com.stellarsql.functions;

import com.stellarsql.types.DataType;
import com.stellarsql.types.DoubleType;
import com.stellarsql.types.GeometryType;
import com.stellarsql.types.IntegerType;
import com.stellarsql.types.LongType;
import com.stellarsql.types.StringType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.stellarsql.functions.ParameterType.GEOMETRY;
import static com.stellarsql.functions.ParameterType.INTEGER;
import static com.stellarsql.functions.ParameterType.NUMERIC;
import static com.stellarsql.functions.ParameterType.POINT;
import static com.stellarsql.functions.ParameterType.SCALAR;
import static com.stellarsql.functions.ParameterType.STRING;

/**
 * Registry of the functions an ADQL query may call, with their PostgreSQL
 * translations.
 *
 * <p>Function categories:
 * <ul>
 *   <li>Math functions: abs, ceiling, floor, round, sqrt, power, log, etc.</li>
 *   <li>Trigonometric functions: sin, cos, tan, cot, acos, asin, atan, atan2</li>
 *   <li>String functions: lower, upper</li>
 *   <li>Conditional functions: coalesce</li>
 *   <li>Aggregate functions: count, avg, min, max, sum</li>
 *   <li>Geometry functions: contains, intersects, distance, area, centroid,
 *       coord1, coord2, coordsys</li>
 *   <li>User-defined functions: gavo_match, ivo_hasword, ivo_nocasecmp,
 *       ivo_hashlist_has</li>
 * </ul>
 *
 * <p>Lookups are case-insensitive. A registry is immutable once built and
 * may be shared between threads.
 */
public final class FunctionRegistry {

    private static final FunctionRegistry BUILTINS = builder().addBuiltins().build();

    private final Map<String, List<FunctionSignature>> signatures;

    private FunctionRegistry(Map<String, List<FunctionSignature>> signatures) {
        Map<String, List<FunctionSignature>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<FunctionSignature>> entry : signatures.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        this.signatures = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the registry with the standard ADQL functions and the
     * user-defined functions.
     *
     * @return the shared built-in registry
     */
    public static FunctionRegistry builtins() {
        return BUILTINS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Finds the overload that accepts the given argument types.
     *
     * @param name the function name, any case
     * @param argumentTypes the annotated argument types
     * @return the first matching signature, or empty
     */
    public Optional<FunctionSignature> lookup(String name, List<DataType> argumentTypes) {
        for (FunctionSignature signature : signatures(name)) {
            if (signature.accepts(argumentTypes)) {
                return Optional.of(signature);
            }
        }
        return Optional.empty();
    }

    public boolean isKnown(String name) {
        return name != null && signatures.containsKey(name.toUpperCase(Locale.ROOT));
    }

    /**
     * Returns all overloads registered under a name.
     *
     * @param name the function name, any case
     * @return the signatures in registration order, empty if unknown
     */
    public List<FunctionSignature> signatures(String name) {
        if (name == null) {
            return Collections.emptyList();
        }
        return signatures.getOrDefault(name.toUpperCase(Locale.ROOT), Collections.emptyList());
    }

    /**
     * Tests whether any overload of the function takes this many arguments.
     *
     * @param name the function name
     * @param arity the argument count
     * @return true if the arity is accepted
     */
    public boolean acceptsArity(String name, int arity) {
        for (FunctionSignature signature : signatures(name)) {
            if (signature.acceptsArity(arity)) {
                return true;
            }
        }
        return false;
    }

    public int registeredFunctionCount() {
        return signatures.size();
    }

    /**
     * Builder for {@link FunctionRegistry}. Overloads of one name are tried
     * in the order they were added.
     */
    public static final class Builder {
        private final Map<String, List<FunctionSignature>> signatures = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(FunctionSignature signature) {
            signatures.computeIfAbsent(signature.name(), k -> new ArrayList<>()).add(signature);
            return this;
        }

        public Builder addBuiltins() {
            initializeMathFunctions(this);
            initializeTrigonometricFunctions(this);
            initializeStringFunctions(this);
            initializeConditionalFunctions(this);
            initializeAggregateFunctions(this);
            initializeGeometryFunctions(this);
            initializeUserFunctions(this);
            return this;
        }

        public FunctionRegistry build() {
            return new FunctionRegistry(signatures);
        }
    }

    // ==================== Math Functions ====================

    private static void initializeMathFunctions(Builder registry) {
        // Metadata-preserving
        registry.register(math("ABS", "abs", NUMERIC).returnType(FunctionSignature.firstArgType())
            .metadata(FunctionSignature.keepArgumentMetadata()).build());
        registry.register(math("CEILING", "ceil", NUMERIC).returnType(FunctionSignature.firstArgType())
            .metadata(FunctionSignature.keepArgumentMetadata()).build());
        registry.register(math("FLOOR", "floor", NUMERIC).returnType(FunctionSignature.firstArgType())
            .metadata(FunctionSignature.keepArgumentMetadata()).build());
        registry.register(math("ROUND", "round", NUMERIC).returnType(FunctionSignature.firstArgType())
            .metadata(FunctionSignature.keepArgumentMetadata()).build());
        registry.register(FunctionSignature.builder("ROUND").parameters(NUMERIC, INTEGER)
            .returns(DoubleType.get())
            .metadata(FunctionSignature.keepArgumentMetadata())
            .translation(BackendTranslation.template("ROUND(CAST({0} AS numeric), {1})"))
            .build());
        registry.register(math("TRUNCATE", "trunc", NUMERIC).returnType(FunctionSignature.firstArgType())
            .metadata(FunctionSignature.keepArgumentMetadata()).build());
        registry.register(FunctionSignature.builder("TRUNCATE").parameters(NUMERIC, INTEGER)
            .returns(DoubleType.get())
            .metadata(FunctionSignature.keepArgumentMetadata())
            .translation(BackendTranslation.template("TRUNC(CAST({0} AS numeric), {1})"))
            .build());

        // Unit-changing
        registry.register(math("DEGREES", "degrees", NUMERIC)
            .metadata(FunctionSignature.keepUcdWithUnit("deg")).build());
        registry.register(math("RADIANS", "radians", NUMERIC)
            .metadata(FunctionSignature.keepUcdWithUnit("rad")).build());

        // Dimensionless
        registry.register(math("EXP", "exp", NUMERIC).build());
        registry.register(math("LOG", "ln", NUMERIC).build());
        registry.register(math("LOG10", "log", NUMERIC).build());
        registry.register(math("SQRT", "sqrt", NUMERIC).build());
        registry.register(math("POWER", "power", NUMERIC, NUMERIC).build());
        registry.register(math("PI", "pi").build());
        registry.register(math("RAND", "random").build());
        registry.register(FunctionSignature.builder("RAND").parameters(NUMERIC)
            .translation(BackendTranslation.unsupported("RAND with a seed cannot be evaluated by the backend"))
            .build());
        registry.register(FunctionSignature.builder("SQUARE").parameters(NUMERIC)
            .returnType(FunctionSignature.firstArgType())
            .translation(BackendTranslation.template("POWER({0}, 2)"))
            .build());
        registry.register(math("MOD", "mod", NUMERIC, NUMERIC)
            .returnType(FunctionSignature.promotedArgs()).build());
    }

    private static FunctionSignature.Builder math(String name, String backendName, ParameterType... params) {
        return FunctionSignature.builder(name)
            .category(FunctionCategory.MATH)
            .parameters(params)
            .returns(DoubleType.get())
            .translation(BackendTranslation.rename(backendName));
    }

    // ==================== Trigonometric Functions ====================

    private static void initializeTrigonometricFunctions(Builder registry) {
        for (String name : List.of("SIN", "COS", "TAN", "COT")) {
            registry.register(trig(name, NUMERIC).build());
        }
        // Inverse functions return angles
        for (String name : List.of("ACOS", "ASIN", "ATAN")) {
            registry.register(trig(name, NUMERIC).metadata(FunctionSignature.unit("rad")).build());
        }
        registry.register(trig("ATAN2", NUMERIC, NUMERIC).metadata(FunctionSignature.unit("rad")).build());
    }

    private static FunctionSignature.Builder trig(String name, ParameterType... params) {
        return FunctionSignature.builder(name)
            .category(FunctionCategory.TRIGONOMETRIC)
            .parameters(params)
            .returns(DoubleType.get());
    }

    // ==================== String Functions ====================

    private static void initializeStringFunctions(Builder registry) {
        for (String name : List.of("LOWER", "UPPER")) {
            registry.register(FunctionSignature.builder(name)
                .category(FunctionCategory.STRING)
                .parameters(STRING)
                .returns(StringType.get())
                .metadata(FunctionSignature.keepArgumentMetadata())
                .build());
        }
    }

    // ==================== Conditional Functions ====================

    private static void initializeConditionalFunctions(Builder registry) {
        registry.register(FunctionSignature.builder("COALESCE")
            .category(FunctionCategory.CONDITIONAL)
            .parameters(SCALAR)
            .variadic(true)
            .returnType(FunctionSignature.unifiedArgs())
            .metadata(FunctionSignature.keepArgumentMetadata())
            .build());
    }

    // ==================== Aggregate Functions ====================

    private static void initializeAggregateFunctions(Builder registry) {
        registry.register(FunctionSignature.builder("COUNT")
            .category(FunctionCategory.AGGREGATE)
            .acceptsStar(true)
            .returns(LongType.get())
            .metadata(FunctionSignature.aggregate("meta.number", ""))
            .build());
        registry.register(FunctionSignature.builder("COUNT")
            .category(FunctionCategory.AGGREGATE)
            .parameters(SCALAR)
            .returns(LongType.get())
            .metadata(FunctionSignature.aggregate("meta.number", ""))
            .build());
        registry.register(FunctionSignature.builder("AVG")
            .category(FunctionCategory.AGGREGATE)
            .parameters(NUMERIC)
            .returns(DoubleType.get())
            .metadata(FunctionSignature.aggregate("stat.mean", null))
            .build());
        registry.register(FunctionSignature.builder("MIN")
            .category(FunctionCategory.AGGREGATE)
            .parameters(SCALAR)
            .returnType(FunctionSignature.firstArgType())
            .metadata(FunctionSignature.aggregate("stat.min", null))
            .build());
        registry.register(FunctionSignature.builder("MAX")
            .category(FunctionCategory.AGGREGATE)
            .parameters(SCALAR)
            .returnType(FunctionSignature.firstArgType())
            .metadata(FunctionSignature.aggregate("stat.max", null))
            .build());
        registry.register(FunctionSignature.builder("SUM")
            .category(FunctionCategory.AGGREGATE)
            .parameters(NUMERIC)
            .returnType(FunctionSignature.sumType())
            .metadata(FunctionSignature.aggregate(null, null))
            .build());
    }

    // ==================== Geometry Functions ====================

    private static void initializeGeometryFunctions(Builder registry) {
        registry.register(geometry("CONTAINS", GEOMETRY, GEOMETRY).returns(IntegerType.get()).build());
        registry.register(geometry("INTERSECTS", GEOMETRY, GEOMETRY).returns(IntegerType.get()).build());
        registry.register(geometry("DISTANCE", POINT, POINT).returns(DoubleType.get())
            .metadata(FunctionSignature.unit("deg")).build());
        registry.register(geometry("DISTANCE", NUMERIC, NUMERIC, NUMERIC, NUMERIC).returns(DoubleType.get())
            .metadata(FunctionSignature.unit("deg")).build());
        registry.register(geometry("AREA", GEOMETRY).returns(DoubleType.get())
            .metadata(FunctionSignature.unit("deg**2")).build());
        registry.register(geometry("CENTROID", GEOMETRY).returns(GeometryType.point())
            .metadata(FunctionSignature.keepArgumentMetadata()).build());
        registry.register(geometry("COORD1", POINT).returns(DoubleType.get())
            .metadata(FunctionSignature.unit("deg")).build());
        registry.register(geometry("COORD2", POINT).returns(DoubleType.get())
            .metadata(FunctionSignature.unit("deg")).build());
        registry.register(geometry("COORDSYS", GEOMETRY).returns(StringType.get()).build());
    }

    private static FunctionSignature.Builder geometry(String name, ParameterType... params) {
        return FunctionSignature.builder(name)
            .category(FunctionCategory.GEOMETRY)
            .parameters(params)
            .translation(BackendTranslation.morpher());
    }

    // ==================== User-defined Functions ====================

    private static void initializeUserFunctions(Builder registry) {
        // gavo_match(pattern, string): POSIX regex match
        registry.register(userFunction("GAVO_MATCH")
            .translation(BackendTranslation.template("(CASE WHEN {1} ~ {0} THEN 1 ELSE 0 END)"))
            .build());
        // Implemented as stored functions in the database
        registry.register(userFunction("IVO_HASWORD").build());
        registry.register(userFunction("IVO_NOCASECMP").build());
        registry.register(userFunction("IVO_HASHLIST_HAS").build());
    }

    private static FunctionSignature.Builder userFunction(String name) {
        return FunctionSignature.builder(name)
            .category(FunctionCategory.USER_DEFINED)
            .parameters(STRING, STRING)
            .returns(IntegerType.get());
    }
}
