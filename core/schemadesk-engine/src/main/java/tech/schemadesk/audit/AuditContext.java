package tech.schemadesk.audit;

import org.jboss.logging.Logger;
import tech.schemadesk.registry.client.SchemaRegistryClient;
import tech.schemadesk.registry.exception.RegistryTimeoutException;
import tech.schemadesk.registry.exception.SchemaRegistryException;

import java.util.List;
import java.util.function.Consumer;

/**
 * State shared by the checks of a single audit run.
 *
 * <p>The active subject listing is fetched on first use and reused by later checks.
 * A failed fetch is not remembered, so every check that needs the listing tries
 * again and fails on its own.
 */
public class AuditContext {

    private static final Logger LOG = Logger.getLogger(AuditContext.class);

    private final SchemaRegistryClient client;
    private final AuditConfig config;
    private final CancellationToken cancellation;
    private List<String> subjects;

    public AuditContext(SchemaRegistryClient client, AuditConfig config, CancellationToken cancellation) {
        this.client = client;
        this.config = config;
        this.cancellation = cancellation;
    }

    public SchemaRegistryClient client() {
        return client;
    }

    public AuditConfig config() {
        return config;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    /**
     * Active subjects, in registry order.
     */
    public List<String> subjects() {
        if (subjects == null) {
            subjects = List.copyOf(client.listSubjects(false));
        }
        return subjects;
    }

    /**
     * The first {@code sampleSize} active subjects.
     */
    public List<String> sample(int sampleSize) {
        List<String> all = subjects();
        return all.subList(0, Math.min(all.size(), Math.max(sampleSize, 0)));
    }

    /**
     * Visit each subject in turn. A registry failure for one subject is logged and the
     * scan moves on; cancellation stops the scan.
     *
     * @param what short label for log lines, e.g. "versions"
     */
    public void scan(List<String> subjects, String what, Consumer<String> action) {
        for (String subject : subjects) {
            cancellation.throwIfCancelled();
            try {
                action.accept(subject);
            } catch (RegistryTimeoutException e) {
                LOG.warnf("Timeout checking %s for %s", what, subject);
            } catch (SchemaRegistryException e) {
                LOG.warnf("Skipping %s check for %s: %s", what, subject, e.getMessage());
            }
        }
    }
}
