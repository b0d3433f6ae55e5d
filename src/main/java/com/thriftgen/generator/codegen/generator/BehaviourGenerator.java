package com.thriftgen.generator.codegen.generator;

import java.util.ArrayList;
import java.util.List;

import com.thriftgen.generator.codegen.mapper.ThriftToJavaTypeMapper;
import com.thriftgen.generator.codegen.model.input.FileGroup;
import com.thriftgen.generator.codegen.model.input.FunctionDef;
import com.thriftgen.generator.codegen.model.input.Schema;
import com.thriftgen.generator.codegen.model.input.ServiceDef;
import com.thriftgen.generator.codegen.model.output.GeneratedUnit;
import com.thriftgen.generator.codegen.model.output.GeneratorKind;

/**
 * Generates {@code <Service>Handler}, the interface a server implements to
 * answer the service's calls.
 */
public class BehaviourGenerator {

    public static final String HANDLER_SUFFIX = "Handler";

    public GeneratedUnit generate(Schema schema, ServiceDef service) {
        FileGroup fileGroup = schema.getFileGroup();
        String fullName = fileGroup.destModule(schema.getModule(), service.getName()) + HANDLER_SUFFIX;
        ServiceSignatures signatures = new ServiceSignatures(new ThriftToJavaTypeMapper(fileGroup));

        String declaration = "public interface " + service.getName() + HANDLER_SUFFIX;
        if (service.getExtendsService() != null) {
            declaration += " extends " + fileGroup.destModule(service.getExtendsService()) + HANDLER_SUFFIX;
        }

        List<String> members = new ArrayList<>();
        for (FunctionDef function : service.getFunctions()) {
            members.add("    /** " + ServiceSignatures.describe(function) + " */\n"
                    + "    " + signatures.signature(function) + ";");
        }

        return GeneratedUnit.builder()
                .moduleName(fullName)
                .generator(GeneratorKind.BEHAVIOUR)
                .javadoc("Server-side callbacks of Thrift service {@code " + service.getName() + "}.")
                .declaration(declaration)
                .members(members)
                .build();
    }
}
