package org.episim.initial;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.episim.api.exceptions.InvalidParameterException;
import org.episim.api.exceptions.TabularSchemaException;
import org.episim.api.model.Compartment;
import org.episim.api.model.DenseArray;
import org.episim.api.model.PopulationParams;
import org.episim.fixtures.ModelFixtures;
import org.episim.io.SeedTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("SeedInitialConditionBuilder Unit Tests")
class SeedInitialConditionBuilderTest {

    private static final double EPS = 1e-9;

    private final PopulationParams population = ModelFixtures.population(new double[][] {
            {100, 50},
            {80, 40},
            {20, 10}});

    private static final int S = Compartment.S.ordinal();
    private static final int A = Compartment.A.ordinal();

    @Nested
    @DisplayName("Seed apportionment")
    class Apportionment {

        @Test
        @DisplayName("Seeds are split 12/16/72 across three age groups and removed from S")
        void defaultFractions() throws Exception {
            SeedInitialConditionBuilder builder =
                    new SeedInitialConditionBuilder(SeedInitialConditionBuilder.DEFAULT_AGE_FRACTIONS);

            DenseArray counts = builder.build(new int[] {3, 2, 10}, population,
                    new SeedTable(new int[] {0}, new double[] {10}));

            assertThat(counts.get(0, 0, A)).isCloseTo(1.2, within(EPS));
            assertThat(counts.get(1, 0, A)).isCloseTo(1.6, within(EPS));
            assertThat(counts.get(2, 0, A)).isCloseTo(7.2, within(EPS));
            assertThat(counts.get(0, 0, S)).isCloseTo(98.8, within(EPS));
            assertThat(counts.get(1, 0, S)).isCloseTo(78.4, within(EPS));
            assertThat(counts.get(2, 0, S)).isCloseTo(12.8, within(EPS));

            // Unseeded patch keeps everybody susceptible
            assertThat(counts.get(0, 1, S)).isEqualTo(50.0);
            assertThat(counts.get(2, 1, S)).isEqualTo(10.0);
            assertThat(counts.get(2, 1, A)).isZero();
        }

        @Test
        @DisplayName("The asymptomatic counts of a patch add up to its seeds exactly")
        void seedsAreConserved() throws Exception {
            SeedInitialConditionBuilder builder = new SeedInitialConditionBuilder(new double[] {0.1, 0.2, 0.7});

            DenseArray counts = builder.build(new int[] {3, 2, 10}, population,
                    new SeedTable(new int[] {1, 1}, new double[] {3, 4}));

            double asymptomatic = counts.get(0, 1, A) + counts.get(1, 1, A) + counts.get(2, 1, A);
            assertThat(asymptomatic).isEqualTo(7.0);
            assertThat(counts.sum()).isCloseTo(population.totalPopulation(), within(EPS));
        }

        @Test
        @DisplayName("Fractional seeds are conserved exactly in every patch")
        void fractionalSeedsAreConserved() throws Exception {
            int patches = 500;
            double[][] people = new double[3][patches];
            int[] seededPatches = new int[patches];
            double[] seedCounts = new double[patches];
            for (int m = 0; m < patches; m++) {
                for (int g = 0; g < 3; g++) {
                    people[g][m] = 1000;
                }
                seededPatches[m] = m;
                seedCounts[m] = m * 0.7 + 0.3;
            }
            SeedInitialConditionBuilder builder =
                    new SeedInitialConditionBuilder(SeedInitialConditionBuilder.DEFAULT_AGE_FRACTIONS);

            DenseArray counts = builder.build(new int[] {3, patches, 10}, ModelFixtures.population(people),
                    new SeedTable(seededPatches, seedCounts));

            for (int m = 0; m < patches; m++) {
                double asymptomatic = counts.get(0, m, A) + counts.get(1, m, A) + counts.get(2, m, A);
                assertThat(asymptomatic).as("patch %d", m).isEqualTo(seedCounts[m]);
            }
        }

        @Test
        void splitWithSingleAgeGroupKeepsTheSeed() throws Exception {
            assertThat(new SeedInitialConditionBuilder(new double[] {1.0}).split(0.1 + 0.2))
                    .containsExactly(0.1 + 0.2);
        }

        @Test
        @DisplayName("With a vaccination axis everybody starts unvaccinated")
        void vaccinationAxis() throws Exception {
            SeedInitialConditionBuilder builder =
                    new SeedInitialConditionBuilder(SeedInitialConditionBuilder.DEFAULT_AGE_FRACTIONS);

            DenseArray counts = builder.build(new int[] {3, 2, 3, 11}, population,
                    new SeedTable(new int[] {0}, new double[] {10}));

            assertThat(counts.get(2, 0, 0, A)).isCloseTo(7.2, within(EPS));
            assertThat(counts.get(0, 1, 0, S)).isEqualTo(50.0);
            assertThat(counts.get(0, 1, 1, S)).isZero();
            assertThat(counts.get(0, 1, 2, S)).isZero();
        }

        @Test
        @DisplayName("Seeds larger than the population clamp S at zero")
        void susceptiblesClamped() throws Exception {
            SeedInitialConditionBuilder builder =
                    new SeedInitialConditionBuilder(SeedInitialConditionBuilder.DEFAULT_AGE_FRACTIONS);

            DenseArray counts = builder.build(new int[] {3, 2, 10}, population,
                    new SeedTable(new int[] {1}, new double[] {100}));

            assertThat(counts.get(2, 1, S)).isZero();
            assertThat(counts.get(2, 1, A)).isCloseTo(72.0, within(EPS));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void fractionsMustSumToOne() {
            assertThatThrownBy(() -> new SeedInitialConditionBuilder(new double[] {0.5, 0.4}))
                    .isInstanceOf(InvalidParameterException.class)
                    .hasMessageContaining("sum to 1");
        }

        @Test
        void fractionsMustBeNonNegative() {
            assertThatThrownBy(() -> new SeedInitialConditionBuilder(new double[] {1.5, -0.5}))
                    .isInstanceOf(InvalidParameterException.class);
        }

        @Test
        void fractionCountMustMatchAgeGroups() throws Exception {
            SeedInitialConditionBuilder builder = new SeedInitialConditionBuilder(new double[] {0.5, 0.5});

            assertThatThrownBy(() -> builder.build(new int[] {3, 2, 10}, population,
                    new SeedTable(new int[] {0}, new double[] {1})))
                    .isInstanceOf(InvalidParameterException.class);
        }

        @Test
        void seedInUnknownPatch() throws Exception {
            SeedInitialConditionBuilder builder =
                    new SeedInitialConditionBuilder(SeedInitialConditionBuilder.DEFAULT_AGE_FRACTIONS);

            assertThatThrownBy(() -> builder.build(new int[] {3, 2, 10}, population,
                    new SeedTable(new int[] {5}, new double[] {1})))
                    .isInstanceOf(TabularSchemaException.class)
                    .hasMessageContaining("patch 5");
        }
    }
}
