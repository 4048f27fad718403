package com.typedumper.core.renderer.impl;

import com.typedumper.core.model.AssemblyInfo;
import com.typedumper.core.model.TypeEntry;
import com.typedumper.core.renderer.RenderSettings;

import java.util.List;
import java.util.Locale;

/**
 * Builds the text of one C# artifact.
 */
final class CSharpWriter {

    private static final String NEWLINE = "\n";
    private static final String INDENT = "\t";

    private final RenderSettings settings;
    private final StringBuilder sb = new StringBuilder();

    CSharpWriter(RenderSettings settings) {
        this.settings = settings;
    }

    CSharpWriter header(String imageName) {
        sb.append("// Image: ").append(imageName).append(NEWLINE);
        sb.append("// Generated by TypeDumper").append(NEWLINE).append(NEWLINE);
        return this;
    }

    CSharpWriter assemblyAttributes(List<AssemblyInfo> assemblies) {
        for (AssemblyInfo assembly : assemblies) {
            if (assembly.attributes().isEmpty()) {
                continue;
            }
            sb.append("// Assembly: ").append(assembly.name()).append(NEWLINE);
            for (String attribute : assembly.attributes()) {
                sb.append(attribute).append(NEWLINE);
            }
            sb.append(NEWLINE);
        }
        return this;
    }

    CSharpWriter type(TypeEntry type) {
        sb.append("// Namespace: ").append(type.namespace()).append(NEWLINE);
        sb.append(type.declaration());
        if (!settings.suppressMetadata()) {
            sb.append(" // TypeDefIndex: ").append(type.index());
        }
        sb.append(NEWLINE).append('{').append(NEWLINE);

        List<TypeEntry.Field> fields = type.fields().stream()
            .filter(f -> !(settings.mustCompile() && f.compilerGenerated()))
            .toList();
        List<TypeEntry.Method> methods = type.methods().stream()
            .filter(m -> !(settings.mustCompile() && m.compilerGenerated()))
            .toList();

        if (!fields.isEmpty()) {
            sb.append(INDENT).append("// Fields").append(NEWLINE);
            for (TypeEntry.Field field : fields) {
                sb.append(INDENT).append(field.declaration());
                if (!settings.suppressMetadata() && field.offset() >= 0) {
                    sb.append(" // 0x").append(Long.toHexString(field.offset()).toUpperCase(Locale.ROOT));
                }
                sb.append(NEWLINE);
            }
        }

        if (!methods.isEmpty()) {
            if (!fields.isEmpty()) {
                sb.append(NEWLINE);
            }
            sb.append(INDENT).append("// Methods").append(NEWLINE);
            for (TypeEntry.Method method : methods) {
                sb.append(INDENT).append(method.declaration());
                if (!settings.suppressMetadata() && method.address() != 0) {
                    sb.append(" // 0x").append(Long.toHexString(method.address()).toUpperCase(Locale.ROOT));
                }
                sb.append(NEWLINE);
            }
        }

        sb.append('}').append(NEWLINE).append(NEWLINE);
        return this;
    }

    String build() {
        return sb.toString();
    }
}
