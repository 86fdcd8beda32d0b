package com.dealsim.types.common;

/**
 * Global constants.
 *
 * @author dealsim
 * @since 2026-03-02
 */
public class Constants {

    /** Comma separator used for string splitting */
    public final static String SPLIT = ",";

    /** Selector sentinel meaning "every entry of the reference catalog" */
    public final static String ALL_SELECTOR = "all";

    /** Synthetic personality used when a selector resolves to nothing */
    public final static String DEFAULT_PERSONALITY = "default";

    /** Synthetic distance used when a selector resolves to nothing */
    public final static String DEFAULT_DISTANCE = "medium";

}
