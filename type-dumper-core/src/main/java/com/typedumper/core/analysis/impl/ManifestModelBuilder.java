package com.typedumper.core.analysis.impl;

import com.typedumper.core.analysis.BinaryImage;
import com.typedumper.core.analysis.TypeModelBuilder;
import com.typedumper.core.model.AssemblyInfo;
import com.typedumper.core.model.TypeEntry;
import com.typedumper.core.model.TypeModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds type models from {@link ManifestImage}s.
 *
 * <p>Types are ordered by index. Assemblies referenced by a type but not declared in
 * the manifest are added without attributes, after the declared ones.
 */
public class ManifestModelBuilder implements TypeModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(ManifestModelBuilder.class);

    @Override
    public TypeModel buildModel(BinaryImage image) {
        if (!(image instanceof ManifestImage manifest)) {
            throw new IllegalArgumentException("Not a manifest image: " + image);
        }

        List<TypeEntry> types = manifest.types().stream()
            .sorted(Comparator.comparingInt(TypeEntry::index))
            .toList();

        Map<String, AssemblyInfo> assemblies = new LinkedHashMap<>();
        manifest.assemblies().forEach(a -> assemblies.putIfAbsent(a.name(), a));
        for (TypeEntry type : types) {
            if (!type.assembly().isEmpty() && !assemblies.containsKey(type.assembly())) {
                log.debug("Assembly {} of type {} is not declared in the manifest", type.assembly(), type.fullName());
                assemblies.put(type.assembly(), new AssemblyInfo(type.assembly(), List.of()));
            }
        }

        log.debug("Built model of {} with {} types in {} assemblies",
            manifest.name(), types.size(), assemblies.size());
        return new TypeModel(manifest.name(), new ArrayList<>(assemblies.values()), types);
    }
}
