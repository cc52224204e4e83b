package dev.stepflow.cli;

import dev.stepflow.engine.ConversionSession;
import dev.stepflow.engine.StepClassifier;
import dev.stepflow.engine.StepStore;
import dev.stepflow.io.ClassificationConfigLoader;
import dev.stepflow.io.DictionaryCodec;
import dev.stepflow.io.FlowDiagramImporter;
import dev.stepflow.io.TransitionTableWriter;
import dev.stepflow.model.ClassificationKeywords;
import dev.stepflow.model.DictionaryKind;
import dev.stepflow.model.FlowDiagram;
import dev.stepflow.model.TransitionRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line front end: compiles a diagram file into a transition table.
 */
@Command(
    name = "stepflow",
    mixinStandardHelpOptions = true,
    description = "Compile a flow diagram (JSON) into a state machine transition table (CSV)."
)
public class StepflowCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StepflowCli.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Diagram JSON exported by the editor")
    private Path diagram;

    @Option(names = "--state-dict", description = "State dictionary JSON ({\"qualified name\": \"LABEL\"})")
    private Path stateDictionary;

    @Option(names = "--rule-dict", description = "Rule dictionary JSON ({\"qualified name\": \"LABEL\"})")
    private Path ruleDictionary;

    @Option(names = "--keywords", description = "Classifier keyword configuration JSON (default: built-in keywords)")
    private Path keywords;

    @Option(names = {"-o", "--output"}, description = "CSV output file (default: standard output)")
    private Path output;

    @Option(names = "--validate", description = "Print diagram warnings to standard error")
    private boolean validate;

    @Option(names = "--dump-dictionaries",
        description = "Write the effective state and rule dictionaries into this directory")
    private Path dumpDirectory;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ConversionSession session = openSession();

            if (validate) {
                List<String> warnings = session.warnings();
                warnings.forEach(w -> err.println("warning: " + w));
                log.info("{} warning(s) for {}", warnings.size(), diagram);
            }

            if (dumpDirectory != null) {
                Files.createDirectories(dumpDirectory);
                DictionaryCodec.write(session.dictionary().stateEntries(), dumpDirectory.resolve("state_dictionary.json"));
                DictionaryCodec.write(session.dictionary().ruleEntries(), dumpDirectory.resolve("rule_dictionary.json"));
            }

            List<TransitionRow> rows = session.rows();
            if (output != null) {
                TransitionTableWriter.write(rows, output);
                log.info("Wrote {} row(s) to {}", rows.size(), output);
            } else {
                TransitionTableWriter.write(rows, out);
                out.flush();
            }
            return 0;
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Conversion of {} failed", diagram, e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private ConversionSession openSession() throws IOException {
        FlowDiagram flow = FlowDiagramImporter.loadFromFile(diagram);
        ClassificationKeywords keywordConfig = keywords != null
            ? ClassificationConfigLoader.loadFromFile(keywords)
            : ClassificationConfigLoader.defaults();

        var store = new StepStore();
        store.replaceAll(flow.steps(), flow.connections());
        var session = new ConversionSession(store, new StepClassifier(keywordConfig, flow.classificationRules()));

        session.regenerateDictionaries();
        if (stateDictionary != null) {
            session.dictionary().replace(DictionaryKind.STATE, DictionaryCodec.read(stateDictionary));
        }
        if (ruleDictionary != null) {
            session.dictionary().replace(DictionaryKind.RULE, DictionaryCodec.read(ruleDictionary));
        }
        log.info("Loaded {} step(s) and {} connection(s) from {}",
            store.steps().size(), store.connections().size(), diagram);
        return session;
    }
}
