package com.metabuild.generator.extension;

import java.util.List;

/**
 * Type of a target, e.g. {@code exe} or {@code library}. Defines the
 * properties available in targets of this type.
 */
public interface TargetType {

    String getName();

    /** Properties specific to targets of this type. */
    List<Property> getProperties();
}
