package org.jaffre.model.game;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrickResult {
    private List<TrickCard> cards = new ArrayList<>();
    private String winnerName;
    private int points;
}
