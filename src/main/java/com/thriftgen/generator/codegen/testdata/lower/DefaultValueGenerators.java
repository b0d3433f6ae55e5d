package com.thriftgen.generator.codegen.testdata.lower;

import com.thriftgen.generator.codegen.model.input.FileGroup;
import com.thriftgen.generator.codegen.model.input.TypeRef;
import com.thriftgen.testdata.Gen;
import com.thriftgen.testdata.GenContext;
import com.thriftgen.testdata.Gens;

/**
 * Runtime counterpart of {@link DefaultGeneratorExpressions}: references are
 * looked up in the compiled companions by output name.
 */
public class DefaultValueGenerators implements ValueGenerators {

    private final CompiledTestData companions;

    public DefaultValueGenerators(CompiledTestData companions) {
        this.companions = companions;
    }

    @Override
    public Gen<Object> generatorFor(TypeRef type, FileGroup fileGroup, GenContext context) {
        return switch (type.getKind()) {
            case PRIMITIVE -> switch (type.getPrimitive()) {
                case BOOL -> widen(Gens.bools());
                case BYTE -> widen(Gens.bytes());
                case I16 -> widen(Gens.shorts());
                case I32 -> widen(Gens.ints());
                case I64 -> widen(Gens.longs());
                case DOUBLE -> widen(Gens.doubles());
                case STRING -> widen(Gens.strings());
                case BINARY -> widen(Gens.binaries());
            };
            case LIST -> widen(Gens.listOf(generatorFor(type.getElementType(), fileGroup, context)));
            case SET -> widen(Gens.setOf(generatorFor(type.getElementType(), fileGroup, context)));
            case MAP -> widen(Gens.mapOf(
                    generatorFor(type.getKeyType(), fileGroup, context),
                    generatorFor(type.getElementType(), fileGroup, context)));
            case REFERENCE -> {
                String target = fileGroup.destModule(type.getReferenceName());
                yield Gen.lazy(() -> companions.generator(target, context));
            }
        };
    }

    private static Gen<Object> widen(Gen<?> generator) {
        return generator::generate;
    }
}
