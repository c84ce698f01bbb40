package com.beamcut.domain;

import lombok.Getter;

/**
 * A required part is longer than the raw stock, so no beam could ever hold it.
 */
@Getter
public class InfeasiblePartException extends CuttingException {

    private final double partLength;
    private final double rawLength;

    public InfeasiblePartException(double partLength, double rawLength) {
        super("Part length " + Lengths.format(partLength) + " exceeds raw stock length " + Lengths.format(rawLength));
        this.partLength = partLength;
        this.rawLength = rawLength;
    }
}
