package com.axlabs.neo.stakegov;

import io.neow3j.compiler.CompilationUnit;
import io.neow3j.compiler.Compiler;
import io.neow3j.contract.NefFile;
import io.neow3j.protocol.ObjectMapperFactory;
import io.neow3j.protocol.core.response.ContractManifest;
import io.neow3j.serialization.exceptions.DeserializationException;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static io.neow3j.contract.ContractUtils.writeContractManifestFile;
import static io.neow3j.contract.ContractUtils.writeNefFile;

public class CompilationHelper {

    static final Path OUTPUT_DIR = Paths.get("build", "neow3j");

    // region compilation

    static CompilationUnit compile(Class<?> contractClass) throws IOException {
        return new Compiler().compile(contractClass.getCanonicalName());
    }

    static CompilationUnit compileAndWriteNefAndManifestFiles(Class<?> contractClass) throws IOException {
        CompilationUnit compUnit = compile(contractClass);
        writeNefAndManifestFiles(compUnit);
        return compUnit;
    }

    public static void writeNefAndManifestFiles(CompilationUnit compUnit) throws IOException {
        OUTPUT_DIR.toFile().mkdirs();
        writeNefFile(compUnit.getNefFile(), compUnit.getManifest().getName(), OUTPUT_DIR);
        writeContractManifestFile(compUnit.getManifest(), OUTPUT_DIR);
    }

    // endregion compilation
    // region read compilation output

    static NefFile readNefFile(String contractName) throws IOException, DeserializationException {
        File contractNefFile = OUTPUT_DIR.resolve(contractName + ".nef").toFile();
        return NefFile.readFromFile(contractNefFile);
    }

    static ContractManifest readManifest(String contractName) throws IOException {
        File contractManifestFile = OUTPUT_DIR.resolve(contractName + ".manifest.json").toFile();
        ContractManifest manifest;
        try (FileInputStream s = new FileInputStream(contractManifestFile)) {
            manifest = ObjectMapperFactory.getObjectMapper().readValue(s, ContractManifest.class);
        }
        return manifest;
    }

    // endregion read compilation output

}
