package com.holdco.tycoon.narrative;

import com.holdco.tycoon.business.Business;
import com.holdco.tycoon.event.EventType;
import com.holdco.tycoon.event.GameEvent;
import com.holdco.tycoon.game.GameState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Produces the story line for an event. Asks the configured {@link NarrativeSource} first and
 * falls back to a fixed template whenever the source has nothing or throws.
 */
public class NarrativeService {
    private static final Logger logger = LoggerFactory.getLogger(NarrativeService.class);

    private final NarrativeSource source;

    public NarrativeService(NarrativeSource source) {
        this.source = source;
    }

    /**
     * A service that only ever uses templates.
     */
    public static NarrativeService templatesOnly() {
        return new NarrativeService(null);
    }

    public String narrate(GameEvent event, GameState state) {
        return narrate(event.type(), contextFor(event, state));
    }

    public String narrate(EventType type, NarrativeContext context) {
        if (source != null) {
            try {
                Optional<String> generated = source.generate(type, context);
                if (generated != null && generated.isPresent() && !generated.get().isBlank()) {
                    return generated.get();
                }
            } catch (RuntimeException e) {
                logger.warn("Narrative source failed for {}, using template", type, e);
            }
        }
        return template(type, context);
    }

    public static NarrativeContext contextFor(GameEvent event, GameState state) {
        String businessName = null;
        String sectorName = null;
        Business business = event.affectedBusinessId() != null ? state.findBusiness(event.affectedBusinessId()) : null;
        if (business != null) {
            businessName = business.getName();
            sectorName = state.getSectors().getSector(business.getSectorId()).getName();
        }
        return new NarrativeContext(state.getRound(), event.title(), businessName, sectorName,
            state.getCash(), state.totalEbitda());
    }

    /**
     * Deterministic text for an event type. Never null.
     */
    public static String template(EventType type, NarrativeContext context) {
        String subject = context.businessName() != null ? context.businessName() : "the portfolio";
        String year = "Year " + context.round() + ": ";
        return year + switch (type) {
            case GLOBAL_BULL_MARKET -> "Buyers are everywhere and multiples are stretching.";
            case GLOBAL_RECESSION -> "Demand softens across the economy. Every opco feels it.";
            case GLOBAL_INTEREST_HIKE -> "The central bank raises rates. Floating debt just got dearer.";
            case GLOBAL_INTEREST_CUT -> "Rates come down and lenders are friendlier.";
            case GLOBAL_INFLATION -> "Input costs climb faster than prices can follow.";
            case GLOBAL_CREDIT_TIGHTENING -> "Banks pull back. Acquisition debt is hard to find.";
            case GLOBAL_QUIET -> "A quiet year. Time to focus on the business.";
            case PORTFOLIO_STAR_JOINS -> "A star operator joins " + subject + ".";
            case PORTFOLIO_TALENT_LEAVES -> "Key talent walks out of " + subject + ".";
            case PORTFOLIO_CLIENT_SIGNS -> subject + " lands a major new client.";
            case PORTFOLIO_CLIENT_CHURNS -> subject + " loses a major client.";
            case PORTFOLIO_BREAKTHROUGH -> subject + " finds a structural margin improvement.";
            case PORTFOLIO_COMPLIANCE -> "Regulators come calling at " + subject + ".";
            case PORTFOLIO_REFERRAL_DEAL -> "The CEO of " + subject + " introduces a seller.";
            case PORTFOLIO_EQUITY_DEMAND -> "Management at " + subject + " wants a piece of the equity.";
            case PORTFOLIO_SELLER_NOTE_RENEGO -> "The former owner of " + subject + " offers to settle the note early.";
            case SECTOR_EVENT -> context.eventTitle() + " shakes "
                + (context.sectorName() != null ? context.sectorName() : "the sector") + ".";
            case UNSOLICITED_OFFER -> "A buyer makes an unsolicited offer for " + subject + ".";
            case MBO_PROPOSAL -> "The management team of " + subject + " proposes a buyout.";
        };
    }
}
