package work.lcod.markup.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import picocli.CommandLine;
import work.lcod.markup.fuzz.AdversarialGenerator;

@CommandLine.Command(
    name = "fuzz",
    description = "Generate tag-balanced adversarial documents.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class FuzzCommand extends MarkupSubcommand {
    @CommandLine.Option(names = "--complexity", defaultValue = "10", description = "Random-walk steps per document.")
    private int complexity;

    @CommandLine.Option(names = "--count", defaultValue = "1", description = "Number of documents to generate.")
    private int count;

    @CommandLine.Option(names = "--seed", description = "Seed for reproducible output.")
    private Long seed;

    @Override
    public Integer call() throws Exception {
        configuration();
        var generator = new AdversarialGenerator(seed == null ? new Random() : new Random(seed));
        List<String> documents = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            documents.add(generator.generate(complexity));
        }
        emit(documents);
        return 0;
    }
}
