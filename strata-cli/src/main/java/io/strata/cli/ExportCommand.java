package io.strata.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.strata.core.memory.AuditExport;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "export", description = "Export an owner's verified cold archive as JSON")
public final class ExportCommand implements Callable<Integer> {
    private final CliContext context;
    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Option(names = {"-o", "--owner"}, required = true, description = "Owner id")
    String owner;

    @Option(names = "--output", description = "Write to this file instead of stdout")
    Path output;

    public ExportCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            AuditExport export = context.controller().exportForAudit(owner);
            String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(export);
            if (output == null) {
                System.out.println(json);
            } else {
                Path parent = output.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(output, json, StandardCharsets.UTF_8);
                System.out.println("Exported " + export.entries().size() + " entries to " + output);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Export command failed: " + e.getMessage());
            return 1;
        }
    }
}
