package com.typedumper.core.dispatch;

import com.typedumper.core.analysis.BinaryImage;
import com.typedumper.core.model.Toolchain;
import com.typedumper.core.model.TypeEntry;
import com.typedumper.core.model.TypeModel;
import com.typedumper.core.renderer.RecordingSourceRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link LayoutDispatchEngine}.
 */
class LayoutDispatchEngineTest {

    private static final BinaryImage IMAGE = () -> "GameAssembly";

    private RecordingSourceRenderer renderer;
    private TypeModel model;

    @BeforeEach
    void setUp() {
        renderer = new RecordingSourceRenderer();
        model = new TypeModel("GameAssembly", List.of(), List.of(
            TypeEntry.of(0, "Gamma", "Game", "Assembly-CSharp.dll"),
            TypeEntry.of(1, "beta", "Game", "Assembly-CSharp.dll"),
            TypeEntry.of(2, "Alpha", "Game.UI", "Assembly-CSharp.dll"),
            TypeEntry.of(3, "String", "System", "mscorlib.dll")));
    }

    @Test
    void dispatch_singleWithIndex_writesOneFileInIndexOrder() throws DispatchException {
        DumpOptions options = DumpOptions.builder().build();

        new LayoutDispatchEngine().dispatch(IMAGE, model, options, "out/types.cs", renderer);

        assertThat(renderer.calls()).hasSize(1);
        RecordingSourceRenderer.Call call = renderer.calls().get(0);
        assertThat(call.method()).isEqualTo("writeSingleFile");
        assertThat(call.path()).isEqualTo(Paths.get("out/types.cs"));
        assertThat(call.orderedTypes()).extracting(TypeEntry::index).containsExactly(0, 1, 2, 3);
    }

    @Test
    void dispatch_namespaceWithName_ordersTypesOrdinally() throws DispatchException {
        DumpOptions options = DumpOptions.builder()
            .layoutSchema(LayoutSchema.NAMESPACE)
            .sortOrder(SortOrder.NAME)
            .flattenHierarchy(true)
            .build();

        new LayoutDispatchEngine().dispatch(IMAGE, model, options, "out", renderer);

        RecordingSourceRenderer.Call call = renderer.calls().get(0);
        assertThat(call.method()).isEqualTo("writeFilesByNamespace");
        assertThat(call.flag()).isTrue();
        assertThat(call.orderedTypes()).extracting(TypeEntry::name)
            .containsExactly("Alpha", "Gamma", "String", "beta");
    }

    @Test
    void dispatch_namespaceWithIndex_ordersByIndex() throws DispatchException {
        DumpOptions options = DumpOptions.builder()
            .layoutSchema(LayoutSchema.NAMESPACE)
            .sortOrder(SortOrder.INDEX)
            .build();

        new LayoutDispatchEngine().dispatch(IMAGE, model, options, "out", renderer);

        RecordingSourceRenderer.Call call = renderer.calls().get(0);
        assertThat(call.flag()).isFalse();
        assertThat(call.orderedTypes()).extracting(TypeEntry::name)
            .containsExactly("Gamma", "beta", "Alpha", "String");
    }

    @Test
    void dispatch_assembly_passesSeparateAttributesFlag() throws DispatchException {
        DumpOptions options = DumpOptions.builder()
            .layoutSchema(LayoutSchema.ASSEMBLY)
            .separateAssemblyAttributesFiles(true)
            .build();

        new LayoutDispatchEngine().dispatch(IMAGE, model, options, "out", renderer);

        assertThat(renderer.calls()).singleElement().satisfies(call -> {
            assertThat(call.method()).isEqualTo("writeFilesByAssembly");
            assertThat(call.flag()).isTrue();
        });
    }

    @Test
    void dispatch_classAndTree_ignoreSortOrder() throws DispatchException {
        DumpOptions byClass = DumpOptions.builder()
            .layoutSchema(LayoutSchema.CLASS)
            .sortOrder(null)
            .flattenHierarchy(true)
            .build();
        DumpOptions byTree = DumpOptions.builder()
            .layoutSchema(LayoutSchema.TREE)
            .sortOrder(null)
            .build();

        LayoutDispatchEngine engine = new LayoutDispatchEngine();
        engine.dispatch(IMAGE, model, byClass, "out", renderer);
        engine.dispatch(IMAGE, model, byTree, "out", renderer);

        assertThat(renderer.calls()).extracting(RecordingSourceRenderer.Call::method)
            .containsExactly("writeFilesByClass", "writeFilesByClassTree");
        assertThat(renderer.calls().get(0).flag()).isTrue();
        assertThat(renderer.calls().get(1).flag()).isFalse();
    }

    @Test
    void dispatch_removesExcludedNamespacesBeforeRendering() throws DispatchException {
        DumpOptions options = DumpOptions.builder()
            .excludedNamespaces(Set.of("System", "Game.UI"))
            .build();

        new LayoutDispatchEngine().dispatch(IMAGE, model, options, "types.cs", renderer);

        RecordingSourceRenderer.Call call = renderer.calls().get(0);
        assertThat(call.model().types()).extracting(TypeEntry::name).containsExactly("Gamma", "beta");
        assertThat(call.settings().excludedNamespaces()).containsExactlyInAnyOrder("System", "Game.UI");
    }

    @Test
    void dispatch_solution_forcesMustCompileAndPassesToolchain() throws DispatchException {
        Toolchain toolchain = new Toolchain("C:\\Unity\\2019.4", "C:\\Unity\\2019.4\\ScriptAssemblies");
        DumpOptions options = DumpOptions.builder()
            .layoutSchema(LayoutSchema.SINGLE)
            .mustCompile(false)
            .createSolution(true)
            .build();

        new LayoutDispatchEngine(toolchain).dispatch(IMAGE, model, options, "out", renderer);

        RecordingSourceRenderer.Call call = renderer.calls().get(0);
        assertThat(call.method()).isEqualTo("writeSolution");
        assertThat(call.settings().mustCompile()).isTrue();
        assertThat(call.toolchain()).isEqualTo(toolchain);
    }

    @Test
    void dispatch_solutionWithoutToolchain_isUnsupported() {
        DumpOptions options = DumpOptions.builder().createSolution(true).build();

        assertThatThrownBy(() -> new LayoutDispatchEngine().dispatch(IMAGE, model, options, "out", renderer))
            .isInstanceOf(DispatchException.class)
            .extracting(e -> ((DispatchException) e).getReason())
            .isEqualTo(DispatchException.Reason.UNSUPPORTED_COMBINATION);
        assertThat(renderer.calls()).isEmpty();
    }

    @Test
    void dispatch_withoutLayout_isUnsupported() {
        DumpOptions options = DumpOptions.builder().layoutSchema(null).build();

        assertThatThrownBy(() -> new LayoutDispatchEngine().dispatch(IMAGE, model, options, "out", renderer))
            .isInstanceOf(DispatchException.class)
            .extracting(e -> ((DispatchException) e).getReason())
            .isEqualTo(DispatchException.Reason.UNSUPPORTED_COMBINATION);
        assertThat(renderer.calls()).isEmpty();
    }

    @Test
    void dispatch_orderedLayoutWithoutSort_isUnsupported() {
        DumpOptions options = DumpOptions.builder()
            .layoutSchema(LayoutSchema.ASSEMBLY)
            .sortOrder(null)
            .build();

        assertThatThrownBy(() -> new LayoutDispatchEngine().dispatch(IMAGE, model, options, "out", renderer))
            .isInstanceOf(DispatchException.class)
            .hasMessageContaining("assembly");
        assertThat(renderer.calls()).isEmpty();
    }

    @Test
    void dispatch_rendererIoFailure_isRenderFailure() {
        renderer.failingWith(new IOException("disk full"));
        DumpOptions options = DumpOptions.builder().build();

        assertThatThrownBy(() -> new LayoutDispatchEngine().dispatch(IMAGE, model, options, "types.cs", renderer))
            .isInstanceOf(DispatchException.class)
            .hasMessageContaining("disk full")
            .extracting(e -> ((DispatchException) e).getReason())
            .isEqualTo(DispatchException.Reason.RENDER_FAILURE);
    }
}
