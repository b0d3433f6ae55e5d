package com.thriftgen.generator.codegen.generator;

import java.util.stream.Collectors;

import com.thriftgen.generator.codegen.mapper.ThriftToJavaTypeMapper;
import com.thriftgen.generator.codegen.model.input.FieldDef;
import com.thriftgen.generator.codegen.model.input.FunctionDef;
import com.thriftgen.generator.codegen.util.NamingUtil;

/**
 * Java method signatures shared by the service and behaviour generators.
 */
class ServiceSignatures {

    private final ThriftToJavaTypeMapper types;

    ServiceSignatures(ThriftToJavaTypeMapper types) {
        this.types = types;
    }

    String signature(FunctionDef function) {
        String arguments = function.getArguments().stream()
                .map(arg -> types.javaType(arg.getType()) + " " + NamingUtil.toCamelCase(arg.getName()))
                .collect(Collectors.joining(", "));

        StringBuilder sb = new StringBuilder()
                .append(function.isOneway() ? "void" : types.returnType(function.getReturnType()))
                .append(" ").append(NamingUtil.toCamelCase(function.getName()))
                .append("(").append(arguments).append(")");

        if (!function.getExceptions().isEmpty()) {
            sb.append(function.getExceptions().stream()
                    .map(FieldDef::getType)
                    .map(types::javaType)
                    .collect(Collectors.joining(", ", " throws ", "")));
        }
        return sb.toString();
    }

    static String describe(FunctionDef function) {
        String arguments = function.getArguments().stream()
                .map(arg -> arg.getId() + ": " + arg.getType().describe() + " " + arg.getName())
                .collect(Collectors.joining(", "));
        String returns = function.isVoid() ? "void" : function.getReturnType().describe();
        return (function.isOneway() ? "oneway " : "") + returns + " " + function.getName() + "(" + arguments + ")";
    }
}
