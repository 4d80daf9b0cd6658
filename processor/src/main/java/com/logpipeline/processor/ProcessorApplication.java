package com.logpipeline.processor;

import com.logpipeline.common.PipelineRole;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.List;
import java.util.Optional;

/**
 * Processor application that consumes log lines from the Redis queue, parses them
 * and indexes them into PostgreSQL. With the {@code init-db} role it only creates
 * the schema and exits.
 */
@SpringBootApplication(scanBasePackages = "com.logpipeline")
public class ProcessorApplication {

    static final List<PipelineRole> ROLES = List.of(PipelineRole.PROCESSOR, PipelineRole.INIT_DB);

    public static void main(String[] args) {
        Optional<PipelineRole> role = PipelineRole.fromArgs(args).filter(ROLES::contains);
        if (role.isEmpty()) {
            PipelineRole.printUsage(System.err, "java -jar processor.jar", ROLES);
            System.exit(1);
        }
        ConfigurableApplicationContext context = SpringApplication.run(ProcessorApplication.class, args);
        if (role.get() == PipelineRole.INIT_DB) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
