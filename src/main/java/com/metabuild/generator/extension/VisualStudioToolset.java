package com.metabuild.generator.extension;

import java.util.ArrayList;
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
 * Visual Studio solutions and projects. Projects list every configuration
 * explicitly, so the model has to be flattened for this toolset.
 */
public class VisualStudioToolset implements Toolset {

    /** MSBuild macro expanding to the per-configuration intermediate directory. */
    private static final String INTERMEDIATE_DIR = "$(IntDir)";

    private final String name;

    public VisualStudioToolset(String name) {
        this.name = name;
    }

    public static VisualStudioToolset vs2010() {
        return new VisualStudioToolset("vs2010");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean requiresFlattening() {
        return true;
    }

    public String getProjectFileProperty() {
        return name + ".projectfile";
    }

    public String getSolutionFileProperty() {
        return name + ".solutionfile";
    }

    @Override
    public List<Property> getProperties() {
        Property projectFile = Property.builder()
                .name(getProjectFileProperty())
                .scope(PropertyScope.TARGET)
                .type(PropertyType.PATH)
                .toolset(name)
                .defaultValue(part -> new PathExpr(List.of(new LiteralExpr(part.getName() + ".vcxproj")),
                        PathAnchor.SRCDIR, part.getModule().getSourceFile(), null))
                .description("File name of the project for the target.")
                .build();
        Property solutionFile = Property.builder()
                .name(getSolutionFileProperty())
                .scope(PropertyScope.MODULE)
                .type(PropertyType.PATH)
                .toolset(name)
                .defaultValue(part -> new PathExpr(List.of(new LiteralExpr(part.getName() + ".sln")),
                        PathAnchor.SRCDIR, ((Module) part).getSourceFile(), null))
                .description("File name of the solution file for the module.")
                .build();
        return List.of(projectFile, solutionFile);
    }

    @Override
    public PathExpr getBuilddirFor(Target target) {
        Expression projectFile = target.getVariableValue(getProjectFileProperty());
        if (!(projectFile instanceof PathExpr path)) {
            throw new GeneratorException("\"" + getProjectFileProperty() + "\" must be a path, not \""
                    + projectFile + "\"", projectFile.getPosition());
        }
        List<Expression> components = new ArrayList<>(path.getDirectoryComponents());
        components.add(new LiteralExpr(INTERMEDIATE_DIR));
        return new PathExpr(components, path.getAnchor(), path.getAnchorFile(), path.getPosition());
    }
}
