package com.example.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Option price sensitivities. A null field means "not computed", not zero.
 */
@Value
@Builder
public class Greeks implements Serializable {

    private static final long serialVersionUID = 1L;

    Double delta;
    Double gamma;
    Double theta;
    Double vega;
    Double rho;

    @JsonIgnore
    public boolean isEmpty() {
        return delta == null && gamma == null && theta == null && vega == null && rho == null;
    }

    /**
     * Named view of the computed greeks only.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> values = new LinkedHashMap<>();
        if (delta != null) values.put("delta", delta);
        if (gamma != null) values.put("gamma", gamma);
        if (theta != null) values.put("theta", theta);
        if (vega != null) values.put("vega", vega);
        if (rho != null) values.put("rho", rho);
        return values;
    }
}
