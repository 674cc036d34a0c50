package com.stellarsql.functions;

import com.stellarsql.types.DataType;
import com.stellarsql.types.DoubleType;
import com.stellarsql.types.FieldInfo;
import com.stellarsql.types.LongType;
import com.stellarsql.types.NullType;
import com.stellarsql.types.TypeInferenceEngine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One overload of an ADQL function.
 *
 * <p>A signature declares the parameter types, how the result type and the
 * unit/UCD metadata are derived from the arguments, and how the morpher
 * translates the call for PostgreSQL. A variadic signature repeats its last
 * parameter type for any further arguments.
 *
 * <p>Instances are immutable and are built with {@link #builder(String)}:
 * <pre>
 *   FunctionSignature.builder("ABS")
 *       .category(FunctionCategory.MATH)
 *       .parameters(ParameterType.NUMERIC)
 *       .returnType(FunctionSignature.firstArgType())
 *       .metadata(FunctionSignature.keepArgumentMetadata())
 *       .translation(BackendTranslation.rename("abs"))
 *       .build();
 * </pre>
 */
public final class FunctionSignature {

    /**
     * Derives a call's result type from its argument types. Returns null
     * when the arguments have no common result type.
     */
    @FunctionalInterface
    public interface ReturnTypeRule {
        DataType resolve(List<DataType> argumentTypes);
    }

    /**
     * Derives a call's unit, UCD and frame from its arguments' metadata.
     */
    @FunctionalInterface
    public interface MetadataRule {
        FieldInfo derive(List<FieldInfo> arguments, DataType resultType);
    }

    private final String name;
    private final List<ParameterType> parameters;
    private final boolean variadic;
    private final boolean acceptsStar;
    private final FunctionCategory category;
    private final ReturnTypeRule returnType;
    private final MetadataRule metadata;
    private final BackendTranslation translation;

    private FunctionSignature(Builder builder) {
        this.name = builder.name;
        this.parameters = List.copyOf(builder.parameters);
        this.variadic = builder.variadic;
        this.acceptsStar = builder.acceptsStar;
        this.category = builder.category;
        this.returnType = builder.returnType;
        this.metadata = builder.metadata;
        this.translation = builder.translation;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Returns the upper-cased ADQL name.
     *
     * @return the function name
     */
    public String name() {
        return name;
    }

    public List<ParameterType> parameters() {
        return parameters;
    }

    public boolean variadic() {
        return variadic;
    }

    /**
     * Returns true for the {@code COUNT(*)} form, which takes no arguments.
     *
     * @return whether this is the star overload
     */
    public boolean acceptsStar() {
        return acceptsStar;
    }

    public FunctionCategory category() {
        return category;
    }

    public boolean isAggregate() {
        return category.isAggregate();
    }

    public BackendTranslation translation() {
        return translation;
    }

    /**
     * Tests whether a call with this many arguments fits this signature.
     *
     * @param arity the argument count
     * @return true if the arity is accepted
     */
    public boolean acceptsArity(int arity) {
        if (variadic) {
            return arity >= parameters.size();
        }
        return arity == parameters.size();
    }

    /**
     * Tests whether arguments of the given types fit this signature.
     *
     * @param argumentTypes the annotated argument types
     * @return true if every argument is accepted by its parameter and the
     *         arguments yield a result type
     */
    public boolean accepts(List<DataType> argumentTypes) {
        if (!acceptsArity(argumentTypes.size())) {
            return false;
        }
        for (int i = 0; i < argumentTypes.size(); i++) {
            if (!parameterAt(i).accepts(argumentTypes.get(i))) {
                return false;
            }
        }
        return returnType.resolve(argumentTypes) != null;
    }

    private ParameterType parameterAt(int index) {
        return index < parameters.size() ? parameters.get(index) : parameters.get(parameters.size() - 1);
    }

    public DataType resultType(List<DataType> argumentTypes) {
        return returnType.resolve(argumentTypes);
    }

    /**
     * Computes the call's field info from the annotated arguments.
     *
     * @param arguments the arguments' field infos, in order
     * @return the field info for the call
     */
    public FieldInfo resultInfo(List<FieldInfo> arguments) {
        List<DataType> types = new ArrayList<>(arguments.size());
        for (FieldInfo argument : arguments) {
            types.add(argument.type());
        }
        return metadata.derive(arguments, resultType(types));
    }

    // ==================== Return type rules ====================

    public static ReturnTypeRule fixed(DataType type) {
        return args -> type;
    }

    /** The first argument's type; DOUBLE if that argument is NULL. */
    public static ReturnTypeRule firstArgType() {
        return args -> {
            DataType first = args.get(0);
            return first instanceof NullType ? DoubleType.get() : first;
        };
    }

    /** Numeric promotion across all arguments. */
    public static ReturnTypeRule promotedArgs() {
        return args -> {
            DataType result = NullType.get();
            for (DataType arg : args) {
                result = TypeInferenceEngine.promoteNumericTypes(result, arg);
            }
            return result instanceof NullType ? DoubleType.get() : result;
        };
    }

    /** Unification across all arguments, as for COALESCE; null if they do not unify. */
    public static ReturnTypeRule unifiedArgs() {
        return args -> {
            DataType result = NullType.get();
            for (DataType arg : args) {
                result = TypeInferenceEngine.unifyTypes(result, arg);
                if (result == null) {
                    return null;
                }
            }
            return result;
        };
    }

    /** BIGINT for integral arguments, DOUBLE otherwise. */
    public static ReturnTypeRule sumType() {
        return args -> TypeInferenceEngine.isIntegral(args.get(0)) ? LongType.get() : DoubleType.get();
    }

    // ==================== Metadata rules ====================

    /** No unit, no UCD. */
    public static MetadataRule dimensionless() {
        return (args, type) -> FieldInfo.of(type);
    }

    /** Copies unit, UCD and frame of the first argument. */
    public static MetadataRule keepArgumentMetadata() {
        return (args, type) -> args.isEmpty() ? FieldInfo.of(type) : args.get(0).withType(type);
    }

    /** Copies the first argument's UCD and sets the unit. */
    public static MetadataRule keepUcdWithUnit(String unit) {
        return (args, type) -> new FieldInfo(type, unit, args.isEmpty() ? "" : args.get(0).ucd(), null);
    }

    /** Sets the unit; the UCD is empty. */
    public static MetadataRule unit(String unit) {
        return (args, type) -> new FieldInfo(type, unit, "", null);
    }

    /**
     * Aggregate metadata: the UCD is prefixed with {@code ucdPrefix} when the
     * argument has a UCD, and the unit is kept unless {@code newUnit} is given.
     *
     * @param ucdPrefix UCD word to prepend, or null to keep the UCD
     * @param newUnit unit to set, or null to keep the argument's unit
     * @return the rule
     */
    public static MetadataRule aggregate(String ucdPrefix, String newUnit) {
        return (args, type) -> {
            FieldInfo arg = args.isEmpty() ? FieldInfo.of(type) : args.get(0);
            String ucd;
            if (args.isEmpty()) {
                ucd = ucdPrefix == null ? "" : ucdPrefix;
            } else if (ucdPrefix == null || arg.ucd().isEmpty()) {
                ucd = arg.ucd();
            } else {
                ucd = ucdPrefix + ";" + arg.ucd();
            }
            String unit = newUnit == null ? arg.unit() : newUnit;
            return new FieldInfo(type, unit, ucd, newUnit == null ? arg.frame() : null);
        };
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FunctionSignature)) {
            return false;
        }
        FunctionSignature that = (FunctionSignature) obj;
        return name.equals(that.name) && parameters.equals(that.parameters)
            && variadic == that.variadic && acceptsStar == that.acceptsStar;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters, variadic, acceptsStar);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('(');
        if (acceptsStar) {
            sb.append('*');
        }
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(parameters.get(i).name().toLowerCase(Locale.ROOT));
        }
        if (variadic) {
            sb.append(", ...");
        }
        return sb.append(')').toString();
    }

    /**
     * Builder for {@link FunctionSignature}.
     */
    public static final class Builder {
        private final String name;
        private List<ParameterType> parameters = Collections.emptyList();
        private boolean variadic;
        private boolean acceptsStar;
        private FunctionCategory category = FunctionCategory.MATH;
        private ReturnTypeRule returnType = fixed(DoubleType.get());
        private MetadataRule metadata = dimensionless();
        private BackendTranslation translation;

        private Builder(String name) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Function name must not be null or empty");
            }
            this.name = name.toUpperCase(Locale.ROOT);
        }

        public Builder parameters(ParameterType... types) {
            this.parameters = Arrays.asList(types);
            return this;
        }

        public Builder variadic(boolean variadic) {
            this.variadic = variadic;
            return this;
        }

        public Builder acceptsStar(boolean acceptsStar) {
            this.acceptsStar = acceptsStar;
            return this;
        }

        public Builder category(FunctionCategory category) {
            this.category = Objects.requireNonNull(category, "category");
            return this;
        }

        public Builder returnType(ReturnTypeRule returnType) {
            this.returnType = Objects.requireNonNull(returnType, "returnType");
            return this;
        }

        public Builder returns(DataType type) {
            return returnType(fixed(type));
        }

        public Builder metadata(MetadataRule metadata) {
            this.metadata = Objects.requireNonNull(metadata, "metadata");
            return this;
        }

        public Builder translation(BackendTranslation translation) {
            this.translation = translation;
            return this;
        }

        public FunctionSignature build() {
            if (variadic && parameters.isEmpty()) {
                throw new IllegalStateException("A variadic function needs at least one parameter: " + name);
            }
            if (translation == null) {
                translation = BackendTranslation.rename(name.toLowerCase(Locale.ROOT));
            }
            return new FunctionSignature(this);
        }
    }
}
