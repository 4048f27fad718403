package com.typedumper.core.renderer.impl;

import com.typedumper.core.model.TypeEntry;
import com.typedumper.core.model.TypeModel;
import com.typedumper.core.renderer.GeneratedFile;
import com.typedumper.core.renderer.GeneratedOutput;
import com.typedumper.core.renderer.OutputRenderer;
import com.typedumper.core.renderer.RenderContext;
import com.typedumper.core.renderer.ScriptRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes an IDA Python script that names every compiled method of an image.
 *
 * <p>Symbols use the {@code Namespace.Type$$Method} convention. Methods without a
 * compiled body (address 0) are skipped. Namespace exclusion does not apply here: the
 * script always covers the whole image.
 */
public class IdaPythonScriptRenderer implements ScriptRenderer {

    private static final Logger log = LoggerFactory.getLogger(IdaPythonScriptRenderer.class);

    private static final String PREAMBLE = """
        #encoding: utf-8
        import idaapi
        import idc

        def SetName(addr, name):
            ret = idc.set_name(addr, name, idc.SN_NOWARN | idc.SN_NOCHECK)
            if ret == 0:
                new_name = name + '_' + str(addr)
                ret = idc.set_name(addr, new_name, idc.SN_NOWARN | idc.SN_NOCHECK)

        """;

    private final OutputRenderer output;

    /**
     * Creates a renderer writing through a {@link FileSystemRenderer}.
     */
    public IdaPythonScriptRenderer() {
        this(new FileSystemRenderer());
    }

    /**
     * Creates a renderer writing through the given output renderer.
     *
     * @param output destination of the script file
     */
    public IdaPythonScriptRenderer(OutputRenderer output) {
        this.output = Objects.requireNonNull(output, "output must not be null");
    }

    @Override
    public void writeScriptToFile(TypeModel model, Path outputFile) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(outputFile, "outputFile must not be null");

        String script = generateScript(model);
        Path absolute = outputFile.toAbsolutePath();
        output.render(
            new GeneratedOutput(List.of(
                new GeneratedFile(absolute.getFileName().toString(), script, GeneratedFile.PYTHON))),
            new RenderContext(absolute.getParent(), model.imageName()));
    }

    /**
     * Generates the script text.
     *
     * @param model type model
     * @return Python source
     */
    String generateScript(TypeModel model) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Generated by TypeDumper for image ").append(model.imageName()).append('\n');
        sb.append(PREAMBLE);
        sb.append("print('Processing methods')\n");

        int named = 0;
        List<TypeEntry> types = model.types().stream()
            .sorted(Comparator.comparingInt(TypeEntry::index))
            .toList();
        for (TypeEntry type : types) {
            for (TypeEntry.Method method : type.methods()) {
                if (method.address() == 0) {
                    continue;
                }
                sb.append("SetName(0x").append(Long.toHexString(method.address()).toUpperCase(Locale.ROOT))
                    .append(", '").append(escape(type.fullName() + "$$" + method.name())).append("')\n");
                named++;
            }
        }

        sb.append("print('Script finished!')\n");
        log.debug("Script for {} names {} methods", model.imageName(), named);
        return sb.toString();
    }

    private static String escape(String symbol) {
        return symbol.replace("\\", "\\\\").replace("'", "\\'");
    }
}
