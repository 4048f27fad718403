package com.typedumper.core.renderer.impl;

import com.typedumper.core.model.AssemblyInfo;
import com.typedumper.core.model.NamespaceFilter;
import com.typedumper.core.model.Toolchain;
import com.typedumper.core.model.TypeEntry;
import com.typedumper.core.model.TypeModel;
import com.typedumper.core.renderer.GeneratedFile;
import com.typedumper.core.renderer.GeneratedOutput;
import com.typedumper.core.renderer.OutputRenderer;
import com.typedumper.core.renderer.RenderContext;
import com.typedumper.core.renderer.RenderSettings;
import com.typedumper.core.renderer.SourceRenderer;
import com.typedumper.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Writes type models as C# source files.
 *
 * <p>The declaration text of each type and member is taken from the model as is; this
 * renderer decides which types go into which file, in which order, and which
 * metadata comments surround them.
 *
 * <h2>Layouts</h2>
 * <pre>
 * single      types.cs
 * namespace   Game/Entities.cs           (flattened: Game.Entities.cs)
 * assembly    Assembly-CSharp.cs         (+ AssemblyInfo_Assembly-CSharp.cs when separated)
 * class       Game/Entities/Player.cs    (flattened: Game.Entities.Player.cs)
 * tree        Assembly-CSharp/Game/Entities/Player.cs
 *             Assembly-CSharp/Properties/AssemblyInfo.cs
 * solution    tree + Assembly-CSharp/Assembly-CSharp.csproj + &lt;image&gt;.sln
 * </pre>
 *
 * <p>Types of the global namespace go to {@code global.cs} in the per-namespace layout
 * and to the layout root in the per-class layouts. Assembly-level attributes go to the
 * top of the single file and to a root {@code AssemblyInfo.cs} in the per-namespace and
 * per-class layouts.
 *
 * <p>Those two names are reserved. A type or namespace that would map onto a reserved
 * or already written file gets a {@code -N} suffix instead of overwriting it.
 */
public class CSharpSourceRenderer implements SourceRenderer {

    private static final Logger log = LoggerFactory.getLogger(CSharpSourceRenderer.class);

    private static final String EXTENSION = ".cs";
    private static final String GLOBAL_NAMESPACE_FILE = "global";
    private static final String ASSEMBLY_INFO = "AssemblyInfo";
    private static final String PROPERTIES_DIR = "Properties";
    private static final String UNKNOWN_ASSEMBLY = "UnknownAssembly";

    // Visual Studio project type GUID for C# projects
    private static final String CSHARP_PROJECT_TYPE = "9A19103F-16F7-4668-BE54-9A1E7A4F7556";

    private final OutputRenderer output;

    /**
     * Creates a renderer writing through a {@link FileSystemRenderer}.
     */
    public CSharpSourceRenderer() {
        this(new FileSystemRenderer());
    }

    /**
     * Creates a renderer writing through the given output renderer.
     *
     * @param output destination of generated files
     */
    public CSharpSourceRenderer(OutputRenderer output) {
        this.output = Objects.requireNonNull(output, "output must not be null");
    }

    @Override
    public void writeSingleFile(TypeModel model, RenderSettings settings, Path outputFile,
                                Comparator<TypeEntry> order) {
        List<TypeEntry> types = visibleTypes(model, settings, order);

        CSharpWriter writer = new CSharpWriter(settings)
            .header(model.imageName())
            .assemblyAttributes(model.assemblies());
        types.forEach(writer::type);

        Path absolute = outputFile.toAbsolutePath();
        write(model, absolute.getParent(), List.of(
            new GeneratedFile(absolute.getFileName().toString(), writer.build(), GeneratedFile.CSHARP)));
    }

    @Override
    public void writeFilesByNamespace(TypeModel model, RenderSettings settings, Path outputDirectory,
                                      Comparator<TypeEntry> order, boolean flatten) {
        Map<String, List<TypeEntry>> byNamespace = new TreeMap<>();
        for (TypeEntry type : visibleTypes(model, settings, order)) {
            byNamespace.computeIfAbsent(type.namespace(), ns -> new ArrayList<>()).add(type);
        }

        List<GeneratedFile> files = new ArrayList<>();
        Set<String> usedPaths = reserved(ASSEMBLY_INFO + EXTENSION, GLOBAL_NAMESPACE_FILE + EXTENSION);
        byNamespace.forEach((namespace, types) -> {
            String relativePath = namespace.isEmpty()
                ? GLOBAL_NAMESPACE_FILE + EXTENSION
                : claim(usedPaths, namespacePath(namespace, flatten));
            files.add(typesFile(relativePath, model, settings, types));
        });
        addAssemblyInfo(files, ASSEMBLY_INFO + EXTENSION, model, settings, model.assemblies());

        write(model, outputDirectory, files);
    }

    @Override
    public void writeFilesByAssembly(TypeModel model, RenderSettings settings, Path outputDirectory,
                                     Comparator<TypeEntry> order, boolean separateAttributes) {
        List<TypeEntry> types = visibleTypes(model, settings, order);

        List<GeneratedFile> files = new ArrayList<>();
        Set<String> usedPaths = new HashSet<>();
        for (AssemblyInfo assembly : assembliesOf(model, types)) {
            String shortName = assemblyBaseName(assembly);
            String relativePath = claim(usedPaths, shortName);
            List<TypeEntry> assemblyTypes = types.stream()
                .filter(t -> t.assembly().equals(assembly.name()))
                .toList();

            CSharpWriter writer = new CSharpWriter(settings).header(model.imageName());
            if (separateAttributes) {
                addAssemblyInfo(files, claim(usedPaths, ASSEMBLY_INFO + "_" + shortName),
                    model, settings, List.of(assembly));
            } else {
                writer.assemblyAttributes(List.of(assembly));
            }
            assemblyTypes.forEach(writer::type);
            files.add(new GeneratedFile(relativePath, writer.build(), GeneratedFile.CSHARP));
        }

        write(model, outputDirectory, files);
    }

    @Override
    public void writeFilesByClass(TypeModel model, RenderSettings settings, Path outputDirectory,
                                  boolean flatten) {
        List<TypeEntry> types = visibleTypes(model, settings, Comparator.comparingInt(TypeEntry::index));

        List<GeneratedFile> files = new ArrayList<>();
        Set<String> usedPaths = reserved(ASSEMBLY_INFO + EXTENSION);
        for (TypeEntry type : types) {
            String directory = type.namespace().isEmpty() ? "" : namespacePath(type.namespace(), flatten);
            String prefix = directory.isEmpty() ? "" : directory + (flatten ? "." : "/");
            String relativePath = uniquePath(usedPaths, prefix, type);
            files.add(typesFile(relativePath, model, settings, List.of(type)));
        }
        addAssemblyInfo(files, ASSEMBLY_INFO + EXTENSION, model, settings, model.assemblies());

        write(model, outputDirectory, files);
    }

    @Override
    public void writeFilesByClassTree(TypeModel model, RenderSettings settings, Path outputDirectory,
                                      boolean separateAttributes) {
        write(model, outputDirectory, classTreeFiles(model, settings, separateAttributes));
    }

    @Override
    public void writeSolution(TypeModel model, RenderSettings settings, Path outputDirectory,
                              Toolchain toolchain) {
        Objects.requireNonNull(toolchain, "toolchain must not be null");

        List<GeneratedFile> files = new ArrayList<>(classTreeFiles(model, settings, true));
        List<TypeEntry> types = visibleTypes(model, settings, Comparator.comparingInt(TypeEntry::index));
        List<AssemblyInfo> assemblies = assembliesOf(model, types);

        for (AssemblyInfo assembly : assemblies) {
            String projectName = assemblyBaseName(assembly);
            files.add(new GeneratedFile(
                projectName + "/" + projectName + ".csproj",
                projectFile(assembly, toolchain),
                GeneratedFile.MSBUILD));
        }
        files.add(new GeneratedFile(
            FileUtils.sanitizeFileName(model.imageName()) + ".sln",
            solutionFile(assemblies),
            GeneratedFile.SOLUTION));

        log.debug("Solution for {} references toolchain at {} and {}",
            model.imageName(), toolchain.editorPath(), toolchain.assembliesPath());
        write(model, outputDirectory, files);
    }

    /**
     * Builds the per-type files of the tree layout.
     */
    private List<GeneratedFile> classTreeFiles(TypeModel model, RenderSettings settings, boolean separateAttributes) {
        List<TypeEntry> types = visibleTypes(model, settings, Comparator.comparingInt(TypeEntry::index));

        List<GeneratedFile> files = new ArrayList<>();
        Set<String> usedPaths = new HashSet<>();
        for (AssemblyInfo assembly : assembliesOf(model, types)) {
            String assemblyDir = assemblyBaseName(assembly) + "/";
            String assemblyInfoPath = assemblyDir + PROPERTIES_DIR + "/" + ASSEMBLY_INFO + EXTENSION;
            usedPaths.add(pathKey(assemblyInfoPath));
            boolean attributesPending = !separateAttributes && !assembly.attributes().isEmpty();

            for (TypeEntry type : types) {
                if (!type.assembly().equals(assembly.name())) {
                    continue;
                }
                String prefix = assemblyDir
                    + (type.namespace().isEmpty() ? "" : namespacePath(type.namespace(), false) + "/");
                String relativePath = uniquePath(usedPaths, prefix, type);

                CSharpWriter writer = new CSharpWriter(settings).header(model.imageName());
                if (attributesPending) {
                    writer.assemblyAttributes(List.of(assembly));
                    attributesPending = false;
                }
                files.add(new GeneratedFile(relativePath, writer.type(type).build(), GeneratedFile.CSHARP));
            }

            if (separateAttributes || attributesPending) {
                addAssemblyInfo(files, assemblyInfoPath, model, settings, List.of(assembly));
            }
        }
        return files;
    }

    /**
     * Applies namespace exclusion, compile tidying and ordering.
     */
    private List<TypeEntry> visibleTypes(TypeModel model, RenderSettings settings, Comparator<TypeEntry> order) {
        Objects.requireNonNull(order, "order must not be null");
        NamespaceFilter filter = settings.namespaceFilter();
        return filter.retain(model.types()).stream()
            .filter(t -> !(settings.mustCompile() && t.compilerGenerated()))
            .sorted(order)
            .toList();
    }

    /**
     * Returns the assemblies declared by the model that own at least one of the types,
     * followed by assemblies only referenced by types.
     */
    private List<AssemblyInfo> assembliesOf(TypeModel model, List<TypeEntry> types) {
        Map<String, AssemblyInfo> assemblies = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        types.forEach(t -> used.add(t.assembly()));

        for (AssemblyInfo assembly : model.assemblies()) {
            if (used.contains(assembly.name())) {
                assemblies.put(assembly.name(), assembly);
            }
        }
        for (TypeEntry type : types) {
            assemblies.computeIfAbsent(type.assembly(), name -> new AssemblyInfo(name, List.of()));
        }
        return new ArrayList<>(assemblies.values());
    }

    private GeneratedFile typesFile(String relativePath, TypeModel model, RenderSettings settings,
                                    List<TypeEntry> types) {
        CSharpWriter writer = new CSharpWriter(settings).header(model.imageName());
        types.forEach(writer::type);
        return new GeneratedFile(relativePath, writer.build(), GeneratedFile.CSHARP);
    }

    private void addAssemblyInfo(List<GeneratedFile> files, String relativePath, TypeModel model,
                                 RenderSettings settings, List<AssemblyInfo> assemblies) {
        if (assemblies.stream().allMatch(a -> a.attributes().isEmpty())) {
            return;
        }
        String content = new CSharpWriter(settings)
            .header(model.imageName())
            .assemblyAttributes(assemblies)
            .build();
        files.add(new GeneratedFile(relativePath, content, GeneratedFile.CSHARP));
    }

    private static String assemblyBaseName(AssemblyInfo assembly) {
        String shortName = assembly.shortName();
        return shortName.isBlank() ? UNKNOWN_ASSEMBLY : FileUtils.sanitizeFileName(shortName);
    }

    private static String namespacePath(String namespace, boolean flatten) {
        return FileUtils.namespacePath(namespace, flatten ? '.' : '/');
    }

    /**
     * Returns "prefix + TypeName.cs", falling back to "TypeName-index.cs" when the name
     * is taken by another type or a reserved file.
     */
    private static String uniquePath(Set<String> usedPaths, String prefix, TypeEntry type) {
        String name = FileUtils.sanitizeFileName(type.name());
        String candidate = prefix + name + EXTENSION;
        if (usedPaths.add(pathKey(candidate))) {
            return candidate;
        }
        return claim(usedPaths, prefix + name + "-" + type.index());
    }

    /**
     * Returns "stem.cs", or the first free "stem-N.cs".
     */
    private static String claim(Set<String> usedPaths, String stem) {
        String candidate = stem + EXTENSION;
        for (int n = 1; !usedPaths.add(pathKey(candidate)); n++) {
            candidate = stem + "-" + n + EXTENSION;
        }
        return candidate;
    }

    private static Set<String> reserved(String... relativePaths) {
        Set<String> usedPaths = new HashSet<>();
        for (String path : relativePaths) {
            usedPaths.add(pathKey(path));
        }
        return usedPaths;
    }

    // Case-insensitive file systems treat Player.cs and player.cs as one file
    private static String pathKey(String relativePath) {
        return relativePath.toLowerCase(Locale.ROOT);
    }

    private static String projectFile(AssemblyInfo assembly, Toolchain toolchain) {
        String editorManaged = FileUtils.join(toolchain.editorPath(), "Editor/Data/Managed");
        StringBuilder sb = new StringBuilder();
        sb.append("<Project Sdk=\"Microsoft.NET.Sdk\">\n");
        sb.append("  <PropertyGroup>\n");
        sb.append("    <TargetFramework>netstandard2.0</TargetFramework>\n");
        sb.append("    <AssemblyName>").append(assembly.shortName()).append("</AssemblyName>\n");
        sb.append("    <GenerateAssemblyInfo>false</GenerateAssemblyInfo>\n");
        sb.append("    <AllowUnsafeBlocks>true</AllowUnsafeBlocks>\n");
        sb.append("  </PropertyGroup>\n");
        sb.append("  <ItemGroup>\n");
        appendReference(sb, "UnityEngine", FileUtils.join(editorManaged, "UnityEngine.dll"));
        appendReference(sb, "UnityEditor", FileUtils.join(editorManaged, "UnityEditor.dll"));
        appendReference(sb, "UnityEngine.UI", FileUtils.join(toolchain.assembliesPath(), "UnityEngine.UI.dll"));
        sb.append("  </ItemGroup>\n");
        sb.append("</Project>\n");
        return sb.toString();
    }

    private static void appendReference(StringBuilder sb, String name, String hintPath) {
        sb.append("    <Reference Include=\"").append(name).append("\">\n");
        sb.append("      <HintPath>").append(hintPath).append("</HintPath>\n");
        sb.append("    </Reference>\n");
    }

    private static String solutionFile(List<AssemblyInfo> assemblies) {
        StringBuilder sb = new StringBuilder();
        sb.append("Microsoft Visual Studio Solution File, Format Version 12.00\n");
        sb.append("# Visual Studio Version 16\n");
        for (AssemblyInfo assembly : assemblies) {
            String projectName = assemblyBaseName(assembly);
            sb.append("Project(\"{").append(CSHARP_PROJECT_TYPE).append("}\") = \"")
                .append(projectName).append("\", \"")
                .append(projectName).append('\\').append(projectName).append(".csproj\", \"{")
                .append(projectGuid(assembly.name())).append("}\"\n");
            sb.append("EndProject\n");
        }
        sb.append("Global\n");
        sb.append("\tGlobalSection(SolutionConfigurationPlatforms) = preSolution\n");
        sb.append("\t\tDebug|Any CPU = Debug|Any CPU\n");
        sb.append("\t\tRelease|Any CPU = Release|Any CPU\n");
        sb.append("\tEndGlobalSection\n");
        sb.append("EndGlobal\n");
        return sb.toString();
    }

    /**
     * Derives a stable project GUID so repeated runs produce identical solutions.
     */
    static String projectGuid(String assemblyName) {
        return UUID.nameUUIDFromBytes(("typedumper:" + assemblyName).getBytes(StandardCharsets.UTF_8))
            .toString()
            .toUpperCase(Locale.ROOT);
    }

    private void write(TypeModel model, Path outputDirectory, List<GeneratedFile> files) {
        output.render(new GeneratedOutput(files), new RenderContext(outputDirectory, model.imageName()));
    }
}
