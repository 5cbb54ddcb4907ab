package org.jaffre.model.game;

/** Carte du jeu de 32 : quatre couleurs, valeurs 0 à 7. */
public record Card(Color color, int value) {

    public static final int MIN_VALUE = 0;
    public static final int MAX_VALUE = 7;

    public enum Color { RED, BROWN, GREEN, BLUE }

    @Override
    public String toString() {
        return color + " " + value;
    }
}
