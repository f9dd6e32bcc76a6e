package com.metabuild.generator.model;

import java.util.List;
import java.util.Map;

import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.PathExpr;
import com.metabuild.generator.parser.SourcePosition;

/**
 * Source or header file of a target. The file name is stored in the
 * read-only {@code _filename} property, so that model passes process it like
 * any other value.
 */
public class SourceFile extends ModelPart {

    public SourceFile(Target parent, Expression filename, SourcePosition position) {
        super(parent, position);
        if (filename != null) {
            setPropertyValue("_filename", filename);
        }
    }

    @Override
    public String getName() {
        return String.valueOf(getFilename());
    }

    @Override
    public PropertyScope getScope() {
        return PropertyScope.SOURCE_FILE;
    }

    @Override
    public List<ModelPart> getChildParts() {
        return List.of();
    }

    public Target getTarget() {
        return (Target) getParent();
    }

    /** File name, normally a {@link PathExpr}. */
    public Expression getFilename() {
        Variable var = getVariable("_filename");
        return var == null ? null : var.getValue();
    }

    /** Lower-case extension of the file name, or empty if it can't be determined. */
    public String getExtension() {
        if (!(getFilename() instanceof PathExpr path) || path.getComponents().isEmpty()) {
            return "";
        }
        Expression last = path.getComponents().get(path.getComponents().size() - 1);
        if (!(last instanceof LiteralExpr lit)) {
            return "";
        }
        int dot = lit.getValue().lastIndexOf('.');
        return dot >= 0 ? lit.getValue().substring(dot + 1).toLowerCase() : "";
    }

    SourceFile cloneInto(Target newParent, Map<ModelPart, ModelPart> mapping) {
        SourceFile copy = new SourceFile(newParent, null, getPosition());
        mapping.put(this, copy);
        copyVariablesTo(copy);
        return copy;
    }
}
