package com.metarwatch.core.decoder;

import com.metarwatch.core.model.CloudLayer;

import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sky condition. Layers are reported lowest first and only the last one is kept; a clear
 * sky report ends the group.
 */
final class CloudLayerDecoder implements GroupDecoder {
    private static final Set<String> CLEAR = Set.of("SKC", "CLR");
    // CB and TCU suffixes are ignored
    private static final Pattern LAYER = Pattern.compile("(FEW|SCT|BKN|OVC|VV)(\\d{3})\\S*");
    private static final int FEET_PER_UNIT = 100;

    private static final Map<String, String> COVER = Map.of(
            "FEW", "partly cloudy",
            "SCT", "scattered clouds",
            "BKN", "mostly cloudy",
            "OVC", "overcast",
            CloudLayer.VERTICAL_VISIBILITY, "vertical visibility"
    );

    @Override
    public GroupOutcome attempt(String token, ParseSession session, ObservationDraft draft) {
        if (CLEAR.contains(token)) {
            draft.cloudLayer(new CloudLayer(token, "clear", null));
            return GroupOutcome.CONSUMED;
        }
        Matcher matcher = LAYER.matcher(token);
        if (!matcher.matches()) {
            return GroupOutcome.NO_MATCH;
        }

        String code = matcher.group(1);
        Integer altitudeFeet = CloudLayer.VERTICAL_VISIBILITY.equals(code)
                ? Integer.parseInt(matcher.group(2)) * FEET_PER_UNIT
                : null;
        draft.cloudLayer(new CloudLayer(code, COVER.get(code), altitudeFeet));
        return GroupOutcome.CONSUMED_REPEAT;
    }
}
