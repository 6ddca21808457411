package org.episim.api.model;

import java.util.List;

/**
 * Epidemiological compartments in output order.
 * <p>
 * The first ten are integrated by every engine variant. {@link #CH} (confined susceptibles)
 * is derived by the engine; the vaccination variant carries it in its initial conditions as
 * an eleventh compartment.
 */
public enum Compartment {
    S("Susceptible individuals"),
    E("Exposed individuals"),
    A("Asymptomatic infectious individuals"),
    I("Symptomatic infectious individuals"),
    PH("Pre-hospitalized individuals"),
    PD("Pre-deceased individuals"),
    HR("Hospitalized individuals that will recover"),
    HD("Hospitalized individuals that will die"),
    R("Recovered individuals"),
    D("Deceased individuals"),
    CH("Confined individuals");

    private static final List<Compartment> ALL = List.of(values());

    private final String description;

    Compartment(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * Returns the first {@code count} compartments in output order.
     *
     * @param count number of compartments, 1..11
     * @return an immutable prefix of {@link #values()}
     */
    public static List<Compartment> firstN(int count) {
        if (count < 1 || count > ALL.size()) {
            throw new IllegalArgumentException("Compartment count must be in [1, " + ALL.size() + "]: " + count);
        }
        return ALL.subList(0, count);
    }

    public static List<Compartment> all() {
        return ALL;
    }

    /**
     * @return the compartment labels in output order
     */
    public static List<String> labels() {
        return ALL.stream().map(Enum::name).toList();
    }
}
