package com.typedumper.core.analysis;

import com.typedumper.core.model.TypeModel;

/**
 * Reconstructs the type model of an image.
 */
@FunctionalInterface
public interface TypeModelBuilder {

    /**
     * Builds the type model of an image.
     *
     * @param image image produced by the matching analyzer
     * @return type model
     * @throws IllegalArgumentException if the image was produced by another analyzer
     */
    TypeModel buildModel(BinaryImage image);
}
