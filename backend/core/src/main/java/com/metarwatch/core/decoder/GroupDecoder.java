package com.metarwatch.core.decoder;

@FunctionalInterface
interface GroupDecoder {
    /**
     * Inspects one token for this group kind, writing anything it decodes into the draft.
     */
    GroupOutcome attempt(String token, ParseSession session, ObservationDraft draft);
}
