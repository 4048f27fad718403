package com.typedumper.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Represents one reconstructed type definition of an image.
 *
 * <p>The {@code declaration} is the already rendered header line of the type
 * (e.g. {@code "public class Player : MonoBehaviour"}). Its content is produced by
 * the analysis side and treated as opaque text here.
 *
 * @param index type definition index within the image metadata
 * @param name simple type name
 * @param namespace declaring namespace, empty for the global namespace
 * @param assembly name of the owning assembly (e.g. "Assembly-CSharp.dll")
 * @param declaration declaration header text
 * @param compilerGenerated whether the type carries a compiler-generated marker
 * @param fields fields in declaration order
 * @param methods methods in declaration order
 */
public record TypeEntry(
    int index,
    String name,
    String namespace,
    String assembly,
    String declaration,
    boolean compilerGenerated,
    List<Field> fields,
    List<Method> methods
) {
    /**
     * Compact constructor with validation.
     */
    public TypeEntry {
        Objects.requireNonNull(name, "name must not be null");
        if (namespace == null) {
            namespace = "";
        }
        if (assembly == null) {
            assembly = "";
        }
        if (declaration == null) {
            declaration = "class " + name;
        }
        fields = fields == null ? List.of() : List.copyOf(fields);
        methods = methods == null ? List.of() : List.copyOf(methods);
    }

    /**
     * Creates a bare type with no members.
     *
     * @param index type definition index
     * @param name simple type name
     * @param namespace declaring namespace
     * @param assembly owning assembly
     * @return type entry
     */
    public static TypeEntry of(int index, String name, String namespace, String assembly) {
        return new TypeEntry(index, name, namespace, assembly, null, false, List.of(), List.of());
    }

    /**
     * Returns the namespace-qualified name.
     *
     * @return full name, or the simple name for the global namespace
     */
    public String fullName() {
        return namespace.isEmpty() ? name : namespace + "." + name;
    }

    /**
     * A field of a type.
     *
     * @param declaration field declaration text
     * @param offset field offset within the instance, or -1 if unknown
     * @param compilerGenerated whether the field is compiler generated (e.g. a backing field)
     */
    public record Field(
        String declaration,
        long offset,
        boolean compilerGenerated
    ) {
        public Field {
            Objects.requireNonNull(declaration, "declaration must not be null");
        }
    }

    /**
     * A method of a type.
     *
     * @param name method name, used for disassembler symbol names
     * @param declaration method signature text
     * @param address virtual address of the compiled method body, 0 if it has none
     * @param compilerGenerated whether the method is compiler generated
     */
    public record Method(
        String name,
        String declaration,
        long address,
        boolean compilerGenerated
    ) {
        public Method {
            Objects.requireNonNull(name, "name must not be null");
            if (declaration == null) {
                declaration = name + "()";
            }
        }
    }
}
