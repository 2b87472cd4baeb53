package org.carball.abacus.model.result;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class UsersResult {
    private long users;
    private List<DateUsers> dates = new ArrayList<>();

    public boolean hasDates() {
        return !dates.isEmpty();
    }
}
