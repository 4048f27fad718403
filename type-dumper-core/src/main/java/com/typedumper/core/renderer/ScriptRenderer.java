package com.typedumper.core.renderer;

import com.typedumper.core.model.TypeModel;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Produces the disassembler integration script of an image.
 */
public interface ScriptRenderer {

    /**
     * Writes the script for a type model.
     *
     * @param model type model
     * @param outputFile script file to write
     * @throws IOException if writing fails
     */
    void writeScriptToFile(TypeModel model, Path outputFile) throws IOException;
}
