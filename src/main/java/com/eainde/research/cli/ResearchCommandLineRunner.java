package com.eainde.research.cli;

import com.eainde.research.ResearchOrchestrator;
import com.eainde.research.model.Report;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs one research query from the command line and prints the report.
 * The query is taken from the non-option arguments, or read from stdin when there are
 * none.
 */
@Slf4j
@Component
public class ResearchCommandLineRunner implements CommandLineRunner {

    private final ResearchOrchestrator orchestrator;
    private final PrintStream out = System.out;

    public ResearchCommandLineRunner(ResearchOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(String... args) throws IOException {
        String query = queryFromArgs(args);
        if (query.isBlank()) {
            out.print("What would you like to research? ");
            out.flush();
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String line = reader.readLine();
            query = line != null ? line.strip() : "";
        }
        if (query.isBlank()) {
            log.warn("No research query given, nothing to do");
            return;
        }

        Report report = orchestrator.run(query);
        out.print(render(report));
    }

    static String queryFromArgs(String... args) {
        return Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .collect(Collectors.joining(" "))
                .strip();
    }

    static String render(Report report) {
        StringBuilder sb = new StringBuilder();
        section(sb, "REPORT SUMMARY", report.shortSummary());
        section(sb, "REPORT OUTLINE", report.outline());
        section(sb, "FULL REPORT", report.fullReport());
        section(sb, "RESEARCH LIMITATIONS", bullets(report.limitations()));
        section(sb, "FOLLOW UP QUESTIONS", bullets(report.followUps()));
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title, String body) {
        sb.append("\n\n===== ").append(title).append(" =====\n\n").append(body).append('\n');
    }

    private static String bullets(List<String> lines) {
        return lines.stream().map(line -> "- " + line).collect(Collectors.joining("\n"));
    }
}
