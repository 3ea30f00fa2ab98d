package com.gnovoa.liveops.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public final class TournamentBootstrap {

    private static final Logger log = LoggerFactory.getLogger(TournamentBootstrap.class);

    private final LiveOpsProperties props;
    private final TournamentCatalog catalog;
    private final TournamentRegistry registry;

    public TournamentBootstrap(LiveOpsProperties props, TournamentCatalog catalog, TournamentRegistry registry) {
        this.props = props;
        this.catalog = catalog;
        this.registry = registry;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!props.tournaments().loadOnBoot()) return;
        catalog.loadConfigured().forEach(doc -> {
            registry.register(doc);
            log.info("Loaded tournament {} ({} matches, {} assignments)",
                    doc.tournamentId(), doc.matches().size(), doc.schedule().assignments().size());
        });
    }
}
