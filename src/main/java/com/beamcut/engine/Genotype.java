package com.beamcut.engine;

import com.beamcut.domain.CuttingPlan;

import java.util.Arrays;
import java.util.Random;

/**
 * A candidate solution: an ordering of the part-instance indices {@code 0..N-1}.
 * The decoded plan and fitness are attached once, by {@link #evaluate}.
 */
public final class Genotype {

    private final int[] order;
    private CuttingPlan plan;
    private double fitness = Double.NaN;

    Genotype(int[] order) {
        this.order = order;
    }

    /** Fisher-Yates shuffle of the identity permutation. */
    static Genotype random(int size, Random rnd) {
        int[] order = new int[size];
        for (int i = 0; i < size; i++) {
            order[i] = i;
        }
        for (int i = size - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int t = order[i];
            order[i] = order[j];
            order[j] = t;
        }
        return new Genotype(order);
    }

    void evaluate(FirstFitDecoder decoder, FitnessEvaluator evaluator) {
        if (isEvaluated()) {
            return;
        }
        CuttingPlan decoded = decoder.decode(order);
        this.fitness = evaluator.evaluate(decoded);
        this.plan = decoded;
    }

    boolean isEvaluated() {
        return plan != null;
    }

    int size() {
        return order.length;
    }

    int geneAt(int position) {
        return order[position];
    }

    /** Fresh array, never shared with the copy. */
    int[] copyOrder() {
        return order.clone();
    }

    /** Deep copy, keeps the evaluation. */
    Genotype copy() {
        Genotype g = new Genotype(order.clone());
        g.plan = this.plan;
        g.fitness = this.fitness;
        return g;
    }

    public int[] getOrder() {
        return order.clone();
    }

    public CuttingPlan getPlan() {
        return plan;
    }

    public double getFitness() {
        return fitness;
    }

    /**
     * @return true when the order holds each index of {@code 0..size-1} exactly once
     */
    public static boolean isPermutation(int[] order, int size) {
        if (order.length != size) {
            return false;
        }
        boolean[] seen = new boolean[size];
        for (int gene : order) {
            if (gene < 0 || gene >= size || seen[gene]) {
                return false;
            }
            seen[gene] = true;
        }
        return true;
    }

    @Override
    public String toString() {
        return "Genotype{fitness=" + fitness + ", order=" + Arrays.toString(order) + "}";
    }
}
