package com.metabuild.generator.interpreter;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metabuild.generator.error.FlattenException;
import com.metabuild.generator.extension.Toolset;
import com.metabuild.generator.model.ModelPart;
import com.metabuild.generator.model.Module;
import com.metabuild.generator.model.Project;
import com.metabuild.generator.model.Target;
import com.metabuild.generator.model.expr.Expression;
import com.metabuild.generator.model.expr.LiteralExpr;
import com.metabuild.generator.model.expr.PathAnchor;
import com.metabuild.generator.model.expr.PathExpr;
import com.metabuild.generator.model.expr.RewritingVisitor;

/**
 * Makes relative paths absolute: {@code @srcdir} paths are rewritten in terms
 * of {@code @top_srcdir} and, when a toolset is known, {@code @builddir}
 * paths are replaced with the toolset's build directory. Needed so that
 * paths used across modules point to the right place.
 *
 * Call {@link #setContext(ModelPart)} with a module or target before
 * visiting; {@code @builddir} can only be translated in a target.
 */
public class PathsNormalizer extends RewritingVisitor {

    private static final Logger log = LoggerFactory.getLogger(PathsNormalizer.class);

    private final Project project;
    private final Toolset toolset;
    private final Path topSrcdir;
    private final Map<String, Optional<List<Expression>>> prefixCache = new HashMap<>();
    private final Map<Target, PathExpr> builddirCache = new IdentityHashMap<>();

    private Module module;
    private Target target;

    /**
     * @param toolset   toolset to translate {@code @builddir} for, {@code null}
     *                  to leave such paths alone
     * @param topSrcdir directory {@code @top_srcdir} stands for, {@code null}
     *                  for the top module's source directory
     */
    public PathsNormalizer(Project project, Toolset toolset, String topSrcdir) {
        this.project = project;
        this.toolset = toolset;
        String top = topSrcdir != null ? topSrcdir : project.getTopModule().getSrcdir();
        this.topSrcdir = Paths.get(top).toAbsolutePath().normalize();
    }

    public void setContext(ModelPart context) {
        if (context instanceof Target t) {
            this.module = t.getModule();
            this.target = t;
        } else {
            this.module = context.getModule();
            this.target = null;
        }
    }

    @Override
    public Expression visitPath(PathExpr expr) {
        PathExpr e = expr;
        if (e.getAnchor() == PathAnchor.BUILDDIR && toolset != null) {
            if (target == null) {
                throw new FlattenException("@builddir references are not allowed outside of targets",
                        e.getPosition());
            }
            PathExpr builddir = builddirFor(target);
            List<Expression> components = new ArrayList<>(builddir.getComponents());
            components.addAll(e.getComponents());
            e = new PathExpr(components, builddir.getAnchor(), builddir.getAnchorFile(), e.getPosition());
        }
        if (e.getAnchor() == PathAnchor.SRCDIR) {
            String sourceFile;
            if (e.getAnchorFile() != null) {
                sourceFile = e.getAnchorFile();
            } else if (e.getPosition() != null && e.getPosition().filename() != null) {
                sourceFile = e.getPosition().filename();
            } else {
                sourceFile = module.getSourceFile();
            }
            List<Expression> components = e.getComponents();
            Optional<List<Expression>> prefix = sourcePrefix(sourceFile);
            if (prefix.isPresent()) {
                components = new ArrayList<>(prefix.get());
                components.addAll(e.getComponents());
            }
            e = new PathExpr(components, PathAnchor.TOP_SRCDIR, null, e.getPosition());
        }
        return e;
    }

    private Optional<List<Expression>> sourcePrefix(String sourceFile) {
        return prefixCache.computeIfAbsent(sourceFile, file -> {
            Path srcdir = Paths.get(project.getSrcdir(file)).toAbsolutePath().normalize();
            Path relative = topSrcdir.relativize(srcdir);
            log.debug("translating paths from {} with prefix \"{}\"", file, relative);
            if (relative.toString().isEmpty() || relative.toString().equals(".")) {
                return Optional.empty();
            }
            List<Expression> prefix = new ArrayList<>();
            for (Path part : relative) {
                prefix.add(new LiteralExpr(part.toString()));
            }
            return Optional.of(prefix);
        });
    }

    private PathExpr builddirFor(Target t) {
        return builddirCache.computeIfAbsent(t, key -> {
            PathExpr builddir = toolset.getBuilddirFor(key);
            log.debug("translating @builddir paths of {} into {}", key, builddir);
            return builddir;
        });
    }
}
