package com.heimdall.internal.plugins;

import com.heimdall.annotations.HeimdallPlugin;
import com.heimdall.events.DispatchMode;
import com.heimdall.events.EventEnvelope;
import com.heimdall.events.Topics;
import com.heimdall.plugin.Plugin;
import com.heimdall.plugin.PluginCapability;
import com.heimdall.plugin.PluginContext;
import com.heimdall.plugin.PluginDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records every published event into an {@link EventJournal} offered as service {@value #ID}. Plugin and
 * task failures are logged at WARN, everything else at DEBUG. Runs as an async subscriber so publishers
 * never wait on it.
 */
@HeimdallPlugin(id = EventJournalPlugin.ID, version = "0.1.0", displayName = "Event journal",
        capabilities = PluginCapability.OBSERVER)
public final class EventJournalPlugin implements Plugin {

    private static final Logger log = LoggerFactory.getLogger(EventJournalPlugin.class);

    public static final String ID = "heimdall.event-journal";
    public static final String CAPACITY_KEY = "journal.capacity";
    public static final int DEFAULT_CAPACITY = 256;

    private final PluginDescriptor descriptor =
            PluginDescriptor.fromAnnotation(EventJournalPlugin.class.getAnnotation(HeimdallPlugin.class));
    private volatile EventJournal journal;

    @Override
    public PluginDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public void initialize(PluginContext context) {
        int capacity = context.config().getInt(CAPACITY_KEY, DEFAULT_CAPACITY);
        EventJournal created = new EventJournal(capacity);
        context.subscribe("*", this::record, DispatchMode.ASYNC, 0);
        context.registerService(ID, EventJournal.class, created);
        journal = created;
        log.info("Event journal started | capacity={}", capacity);
    }

    private void record(EventEnvelope envelope) {
        EventJournal target = journal;
        if (target == null) return;
        target.append(envelope);
        if (Topics.PLUGIN_FAILED.equals(envelope.topic()) || Topics.TASK_FAILED.equals(envelope.topic())) {
            log.warn("{} | correlationId={} | payload={}", envelope.topic(), envelope.correlationId(), envelope.payload());
        } else if (log.isDebugEnabled()) {
            log.debug("{} | priority={} | correlationId={}", envelope.topic(), envelope.priority(), envelope.correlationId());
        }
    }

    @Override
    public void shutdown() {
        EventJournal target = journal;
        journal = null;
        if (target != null) {
            log.info("Event journal stopped | recorded={}", target.totalRecorded());
        }
    }

    /** The live journal, or null before initialization and after shutdown. */
    EventJournal journal() {
        return journal;
    }
}
