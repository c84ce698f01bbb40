package com.beamcut.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of the demand list: a part length and how many pieces of it are needed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequiredPart {
    private double length;
    private int quantity;

    public static RequiredPart of(double length, int quantity) {
        return new RequiredPart(length, quantity);
    }
}
