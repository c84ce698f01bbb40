package com.beamcut.engine;

import com.beamcut.domain.OptimizerParams;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Breeds the next generation from a fully evaluated one:
 * elitism, tournament selection, order crossover, swap mutation.
 *
 * <p>Runs on the driver thread only. Every random draw comes from the
 * {@link Random} handed in, so a seed fixes the whole sequence.
 */
public class PopulationManager {

    private final OptimizerParams params;
    private final Random rnd;
    private final int instanceCount;

    public PopulationManager(OptimizerParams params, Random rnd, int instanceCount) {
        this.params = params;
        this.rnd = rnd;
        this.instanceCount = instanceCount;
    }

    public List<Genotype> nextGeneration(List<Genotype> population) {
        int size = params.getPopulationSize();
        List<Genotype> next = new ArrayList<>(size);

        // 1) elites survive unmodified
        next.addAll(elites(population, Math.min(params.getEliteCount(), population.size())));

        // 2-4) offspring
        while (next.size() < size) {
            Genotype a = tournamentSelect(population);
            Genotype b = tournamentSelect(population);

            int[] child;
            if (rnd.nextDouble() < params.getCrossoverProbability()) {
                child = orderCrossover(a, b);
            } else {
                child = a.copyOrder();
            }
            if (rnd.nextDouble() < params.getMutationProbability()) {
                swapMutate(child);
            }
            if (params.isVerifyGenotypes()) {
                checkPermutation(child);
            }
            next.add(new Genotype(child));
        }
        return next;
    }

    /**
     * Lowest fitness first, earlier position first on ties.
     */
    static List<Genotype> elites(List<Genotype> population, int count) {
        return IntStream.range(0, population.size())
                .boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> population.get(i).getFitness())
                        .thenComparingInt(i -> i))
                .limit(count)
                .map(population::get)
                .collect(Collectors.toList());
    }

    /** Best of the population, earliest index on ties. */
    static Genotype best(List<Genotype> population) {
        Genotype best = null;
        for (Genotype g : population) {
            if (best == null || g.getFitness() < best.getFitness()) {
                best = g;
            }
        }
        return best;
    }

    Genotype tournamentSelect(List<Genotype> population) {
        int n = population.size();
        int bestIdx = -1;
        for (int i = 0; i < params.getTournamentSize(); i++) {
            int idx = rnd.nextInt(n);
            if (bestIdx < 0 || isBetter(population, idx, bestIdx)) {
                bestIdx = idx;
            }
        }
        return population.get(bestIdx);
    }

    private static boolean isBetter(List<Genotype> population, int idx, int than) {
        double f = population.get(idx).getFitness();
        double g = population.get(than).getFitness();
        return f < g || (f == g && idx < than);
    }

    /**
     * Single cut point: positions {@code [0, cut)} come from {@code a}, the rest are the
     * instances not yet placed, in the order they appear in {@code b}.
     */
    int[] orderCrossover(Genotype a, Genotype b) {
        int n = a.size();
        int[] child = new int[n];
        if (n == 0) {
            return child;
        }
        int cut = rnd.nextInt(n + 1);
        boolean[] placed = new boolean[n];
        for (int i = 0; i < cut; i++) {
            int gene = a.geneAt(i);
            child[i] = gene;
            placed[gene] = true;
        }
        int pos = cut;
        for (int i = 0; i < n && pos < n; i++) {
            int gene = b.geneAt(i);
            if (!placed[gene]) {
                child[pos++] = gene;
                placed[gene] = true;
            }
        }
        return child;
    }

    void swapMutate(int[] order) {
        int n = order.length;
        if (n < 2) {
            return;
        }
        int i = rnd.nextInt(n);
        int j = rnd.nextInt(n - 1);
        if (j >= i) {
            j++;
        }
        int t = order[i];
        order[i] = order[j];
        order[j] = t;
    }

    private void checkPermutation(int[] order) {
        if (!Genotype.isPermutation(order, instanceCount)) {
            throw new IllegalStateException("Offspring is not a permutation of the part instances");
        }
    }
}
