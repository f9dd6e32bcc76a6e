package com.metabuild.generator.extension;

import java.util.List;

import com.metabuild.generator.error.GeneratorException;
import com.metabuild.generator.model.Module;
import com.metabuild.generator.model.PropertyScope;
import com.metabuild.generator.model.Target;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.PathAnchor;
import com.metabuild.generator.model.expr.PathExpr;

/**
 * GNU toolchain with GNU Make makefiles. The build directory of a target is
 * the directory of its module's makefile.
 */
public class GnuToolset implements Toolset {

    public static final String NAME = "gnu";
    public static final String MAKEFILE_PROPERTY = NAME + ".makefile";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Property> getProperties() {
        return List.of(Property.builder()
                .name(MAKEFILE_PROPERTY)
                .scope(PropertyScope.MODULE)
                .type(PropertyType.PATH)
                .toolset(NAME)
                .defaultValue(part -> new PathExpr(List.of(new LiteralExpr("GNUmakefile")), PathAnchor.SRCDIR,
                        ((Module) part).getSourceFile(), null))
                .description("Name of output file for module's makefile.")
                .build());
    }

    @Override
    public PathExpr getBuilddirFor(Target target) {
        Expression makefile = target.getVariableValue(MAKEFILE_PROPERTY);
        if (!(makefile instanceof PathExpr path)) {
            throw new GeneratorException("\"" + MAKEFILE_PROPERTY + "\" must be a path, not \"" + makefile + "\"",
                    makefile.getPosition());
        }
        return new PathExpr(path.getDirectoryComponents(), PathAnchor.TOP_BUILDDIR, null, path.getPosition());
    }
}
