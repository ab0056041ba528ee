package work.lcod.markup.cli;

import picocli.CommandLine;
import work.lcod.markup.api.MarkupParser;
import work.lcod.markup.verify.AuditReport;
import work.lcod.markup.verify.SemanticComplianceAuditor;

@CommandLine.Command(
    name = "audit",
    description = "Check a document for forbidden direct nesting.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class AuditCommand extends InputSubcommand {
    @Override
    public Integer call() throws Exception {
        configuration();
        AuditReport report = new SemanticComplianceAuditor().audit(new MarkupParser().parse(readInput()));
        emit(report.toMap());
        return report.passed() ? 0 : 1;
    }
}
