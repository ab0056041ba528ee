package work.lcod.markup.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import picocli.CommandLine;
import work.lcod.markup.api.MarkupParser;
import work.lcod.markup.verify.AccessibilityAuditor;
import work.lcod.markup.verify.AccessibilityFinding;

@CommandLine.Command(
    name = "a11y",
    description = "Report images without alt text and empty headings.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class AccessibilityCommand extends InputSubcommand {
    @Override
    public Integer call() throws Exception {
        configuration();
        List<AccessibilityFinding> findings = new AccessibilityAuditor().audit(new MarkupParser().parse(readInput()));
        List<Map<String, Object>> rows = new ArrayList<>(findings.size());
        for (AccessibilityFinding finding : findings) {
            rows.add(finding.toMap());
        }
        emit(rows);
        return findings.isEmpty() ? 0 : 1;
    }
}
