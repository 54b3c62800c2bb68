package net.spookly.routeusage.metrics;

/**
 * Default registry audit logger that emits one line per event.
 */
public final class RegistryAuditLogger implements RegistryEventListener {
    public static final RegistryAuditLogger INSTANCE = new RegistryAuditLogger();

    private RegistryAuditLogger() {
    }

    @Override
    public void onEvent(RegistryEvent event) {
        System.out.println(format(event));
    }

    static String format(RegistryEvent event) {
        StringBuilder builder = new StringBuilder("registry_event");
        append(builder, "type", event.type());
        append(builder, "key", event.key());
        append(builder, "storeSize", event.storeSize());
        append(builder, "timestamp", event.timestamp());
        return builder.toString();
    }

    private static void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
