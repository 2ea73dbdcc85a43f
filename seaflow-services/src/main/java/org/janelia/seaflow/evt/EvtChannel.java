package org.janelia.seaflow.evt;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

/**
 * The ten instrument channels of an EVT particle row, in file order.
 */
public enum EvtChannel {
    TIME("time", true),
    PULSE_WIDTH("pulse_width", true),
    D1("D1", false),
    D2("D2", false),
    FSC_SMALL("fsc_small", false),
    FSC_PERP("fsc_perp", false),
    FSC_BIG("fsc_big", false),
    PE("pe", false),
    CHL_SMALL("chl_small", false),
    CHL_BIG("chl_big", false);

    /**
     * Channels holding continuous detector readings; these are the ones that get summarized and log transformed.
     */
    public static final List<EvtChannel> CONTINUOUS = ImmutableList.copyOf(
            Arrays.stream(values()).filter(c -> !c.integral).collect(Collectors.toList()));

    public static final int COUNT = values().length;

    private final String columnName;
    private final boolean integral;

    EvtChannel(String columnName, boolean integral) {
        this.columnName = columnName;
        this.integral = integral;
    }

    public String getColumnName() {
        return columnName;
    }

    public boolean isIntegral() {
        return integral;
    }
}
