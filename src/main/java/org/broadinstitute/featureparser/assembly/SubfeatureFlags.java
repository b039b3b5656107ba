package org.broadinstitute.featureparser.assembly;

import org.broadinstitute.featureparser.cmdline.argumentcollections.ParserArgumentCollection;
import org.broadinstitute.featureparser.utils.Utils;

/**
 * Which kinds of subfeatures a transcript is decomposed into.
 */
public final class SubfeatureFlags {

    /** Exons only, used for gapped peaks whose blocks are sub-peaks. */
    public static final SubfeatureFlags EXONS_ONLY = new SubfeatureFlags(true, false, false, false);

    public static final SubfeatureFlags NONE = new SubfeatureFlags(false, false, false, false);

    public static final SubfeatureFlags ALL = new SubfeatureFlags(true, true, true, true);

    private final boolean doExon;
    private final boolean doCds;
    private final boolean doUtr;
    private final boolean doCodon;

    public SubfeatureFlags(final boolean doExon, final boolean doCds, final boolean doUtr, final boolean doCodon) {
        this.doExon = doExon;
        this.doCds = doCds;
        this.doUtr = doUtr;
        this.doCodon = doCodon;
    }

    public static SubfeatureFlags fromArguments(final ParserArgumentCollection args) {
        Utils.nonNull(args);
        return new SubfeatureFlags(args.doExon, args.doCds, args.doUtr, args.doCodon);
    }

    public boolean doExon() {
        return doExon;
    }

    public boolean doCds() {
        return doCds;
    }

    public boolean doUtr() {
        return doUtr;
    }

    public boolean doCodon() {
        return doCodon;
    }

    @Override
    public String toString() {
        return String.format("exon=%b cds=%b utr=%b codon=%b", doExon, doCds, doUtr, doCodon);
    }
}
