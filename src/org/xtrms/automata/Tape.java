/*
 * @LICENSE@
 */
package org.xtrms.automata;

import java.util.ArrayList;
import java.util.List;

/**
 * The unbounded tape of a {@link TMMachine}. It starts as a single blank
 * cell under the head and grows by one blank cell whenever the head moves
 * off either end, so every cell the head visits exists.
 */
final class Tape {

    private final String blank;
    private final List<String> cells = new ArrayList<String>();
    private int position = 0;

    Tape(String blank) {
        this.blank = blank;
        cells.add(blank);
    }

    String read() {
        return get(position);
    }

    void write(String symbol) {
        while (position >= cells.size()) cells.add(blank);
        cells.set(position, symbol);
    }

    void moveLeft() {
        if (position > 0) {
            position--;
        } else {
            cells.add(0, blank);
        }
    }

    void moveRight() {
        position++;
        if (position >= cells.size()) cells.add(blank);
    }

    void move(TM.Direction direction) {
        switch (direction) {
        case LEFT:
            moveLeft();
            break;
        case RIGHT:
            moveRight();
            break;
        }
    }

    /*
     * head back to the leftmost cell
     */
    void rewind() {
        position = 0;
    }

    int position() {
        return position;
    }

    int size() {
        return cells.size();
    }

    /**
     * @return the symbol in cell <code>i</code>, blank if it was never
     *         visited.
     */
    String get(int i) {
        return i >= 0 && i < cells.size() ? cells.get(i) : blank;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < cells.size(); i++) {
            if (i == position) {
                sb.append('[').append(cells.get(i)).append(']');
            } else {
                sb.append(' ').append(cells.get(i)).append(' ');
            }
        }
        return sb.append(']').toString();
    }
}
