package org.taut.support;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * ESITO DELLA VERIFICA DI VALIDITÀ - Contenitore immutabile
 *
 * • Formula valida: nessun controesempio
 * • Formula non valida: assegnamento (id variabile originale → valore) che la falsifica
 *
 * Le factory method garantiscono la coerenza tra esito e controesempio.
 */
public final class ValidityResult {

    private final boolean valid;
    private final SortedMap<Integer, Boolean> countermodel;

    private ValidityResult(boolean valid, SortedMap<Integer, Boolean> countermodel) {
        this.valid = valid;
        this.countermodel = countermodel;
    }

    /**
     * Crea l'esito per una tautologia.
     */
    public static ValidityResult valid() {
        return new ValidityResult(true, null);
    }

    /**
     * Crea l'esito per una formula non valida.
     *
     * @param countermodel assegnamento falsificante (non null, eventualmente vuoto)
     * @throws IllegalArgumentException se countermodel null
     */
    public static ValidityResult invalid(Map<Integer, Boolean> countermodel) {
        if (countermodel == null) {
            throw new IllegalArgumentException("Una formula non valida richiede un controesempio");
        }
        return new ValidityResult(false, Collections.unmodifiableSortedMap(new TreeMap<>(countermodel)));
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return controesempio ordinato per id variabile, null se la formula è valida
     */
    public SortedMap<Integer, Boolean> getCountermodel() {
        return countermodel;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        ValidityResult other = (ValidityResult) obj;
        return other.valid == valid
                && Objects.equals(other.countermodel, countermodel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(valid, countermodel);
    }

    @Override
    public String toString() {
        if (valid) {
            return "VALIDA";
        }
        StringBuilder builder = new StringBuilder("NON VALIDA {");
        boolean first = true;
        for (Map.Entry<Integer, Boolean> entry : countermodel.entrySet()) {
            if (!first) {
                builder.append(", ");
            }
            builder.append(Variable.PREFIX).append(entry.getKey()).append(" = ").append(entry.getValue());
            first = false;
        }
        return builder.append('}').toString();
    }
}
