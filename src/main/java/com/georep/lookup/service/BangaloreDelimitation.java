package com.georep.lookup.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembly → parliamentary constituency assignment for Bangalore, per the
 * 2008 delimitation order.
 *
 * Note the assembly constituency named "Bangalore South" (Electronic City,
 * Begur, Anjanapura) belongs to the Bangalore Rural PC, not Bangalore South.
 */
public final class BangaloreDelimitation {

    public static final Map<String, List<String>> ASSEMBLY_BY_PARLIAMENTARY;

    static {
        Map<String, List<String>> table = new LinkedHashMap<>();
        // 24
        table.put("Bangalore North", List.of(
            "K.R.Pura", "Byatarayanapura", "Yeshvanthapura", "Dasarahalli",
            "Mahalakshmi Layout", "Malleshwaram", "Hebbal", "Pulakeshinagar(SC)",
            "Yelahanka"));
        // 25
        table.put("Bangalore Central", List.of(
            "Shivajinagar", "Shanti Nagar", "Gandhi Nagar", "Rajaji Nagar",
            "Chamrajpet", "Chickpet", "Sarvagnanagar", "C.V. Raman Nagar(SC)",
            "Mahadevapura"));
        // 26
        table.put("Bangalore South", List.of(
            "Govindraj Nagar", "Vijay Nagar", "Basavanagudi", "Padmanaba Nagar",
            "B.T.M Layout", "Jayanagar", "Bommanahalli"));
        // 23
        table.put("Bangalore Rural", List.of(
            "Rajarajeshwarinagar", "Bangalore South", "Anekal (SC)", "Magadi",
            "Ramanagaram", "Kanakapura", "Channapatna", "Hosakote",
            "Doddaballapur", "Devanahalli (SC)", "Nelamangala (SC)"));
        ASSEMBLY_BY_PARLIAMENTARY = Collections.unmodifiableMap(table);
    }

    private BangaloreDelimitation() {}
}
