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
import com.thriftgen.generator.codegen.util.NamingUtil;

/**
 * Generates the client-facing module of a service: the service and method
 * names used on the wire plus a nested {@code Client} interface.
 */
public class ServiceGenerator {

    public GeneratedUnit generate(Schema schema, ServiceDef service) {
        FileGroup fileGroup = schema.getFileGroup();
        String fullName = fileGroup.destModule(schema.getModule(), service.getName());
        ServiceSignatures signatures = new ServiceSignatures(new ThriftToJavaTypeMapper(fileGroup));

        List<String> members = new ArrayList<>();
        members.add("    public static final String SERVICE_NAME = \"" + service.getName() + "\";");
        for (FunctionDef function : service.getFunctions()) {
            members.add("    public static final String " + NamingUtil.toScreamingSnakeCase(function.getName())
                    + "_METHOD = \"" + function.getName() + "\";");
        }

        StringBuilder client = new StringBuilder("    public interface Client");
        if (service.getExtendsService() != null) {
            client.append(" extends ").append(fileGroup.destModule(service.getExtendsService())).append(".Client");
        }
        client.append(" {\n");
        for (FunctionDef function : service.getFunctions()) {
            client.append("\n        /** ").append(ServiceSignatures.describe(function)).append(" */\n")
                    .append("        ").append(signatures.signature(function)).append(";\n");
        }
        client.append("    }");
        members.add(client.toString());

        return GeneratedUnit.builder()
                .moduleName(fullName)
                .generator(GeneratorKind.SERVICE)
                .javadoc("Thrift service {@code " + service.getName() + "}.")
                .declaration("public final class " + NamingUtil.simpleName(fullName))
                .members(members)
                .build();
    }
}
