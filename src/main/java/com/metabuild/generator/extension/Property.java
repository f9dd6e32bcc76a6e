package com.metabuild.generator.extension;

import java.util.function.Function;

import com.metabuild.generator.error.GeneratorException;
import com.metabuild.generator.model.ModelPart;
import com.metabuild.generator.model.PropertyScope;
import com.metabuild.generator.model.Target;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.NullExpr;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A property: variable with a predefined meaning, with a type, a default
 * value and a scope it is defined in.
 */
@Value
@Builder(toBuilder = true)
public class Property {

    @NonNull
    String name;

    @NonNull
    PropertyScope scope;

    @Builder.Default
    PropertyType type = PropertyType.ANY;

    /**
     * Computes the default for the given model part; {@code null} for required
     * properties.
     */
    Function<ModelPart, Expression> defaultValue;

    boolean readonly;

    boolean inheritable;

    /** Target type this property is specific to, {@code null} for all. */
    String targetType;

    /** Toolset this property is specific to, {@code null} for all. */
    String toolset;

    String description;

    /** True if the property is defined for {@code part}'s scope. */
    public boolean isDirectlyFor(ModelPart part) {
        if (part.getScope() != scope) {
            return false;
        }
        if (targetType != null) {
            return part instanceof Target t && t.getType().getName().equals(targetType);
        }
        return true;
    }

    public boolean appliesToToolset(String toolsetName) {
        return toolset == null || toolset.equals(toolsetName);
    }

    public boolean isRequired() {
        return defaultValue == null;
    }

    /** Default value for {@code part}; null expression for required properties. */
    public Expression defaultExpr(ModelPart part) {
        if (defaultValue == null) {
            return new NullExpr();
        }
        return defaultValue.apply(part);
    }

    /**
     * Default value for {@code part}.
     *
     * @throws GeneratorException if the property is required
     */
    public Expression requireDefault(ModelPart part) {
        if (defaultValue == null) {
            throw new GeneratorException("required property \"" + name + "\" on " + part + " not set",
                    part.getPosition());
        }
        return defaultValue.apply(part);
    }
}
