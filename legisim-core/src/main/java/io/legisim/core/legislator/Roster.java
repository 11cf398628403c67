package io.legisim.core.legislator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/// Repetition-scoped index of every legislator seated in the chamber.
///
/// The roster enforces the chamber's seat count shared by both parties. It does not
/// own its members; each party keeps its own list and the roster only references them.
///
/// ### Contracts
/// - **Invariant**: `size() <= capacity()` at all times
/// - **Postcondition**: after {@link #sortByIdeal()}, members are ordered ascending by
///   ideal point and the sort is stable
///
/// @implNote **Not thread-safe**. One roster per session, one session per thread.
public final class Roster {

    private static final Comparator<Legislator> BY_IDEAL =
            Comparator.comparingDouble(Legislator::getIdeal);

    private final int capacity;
    private final List<Legislator> members = new ArrayList<>();

    /// Creates an empty roster for a chamber of the given size.
    ///
    /// @param capacity total number of seats, must be positive
    /// @throws IllegalArgumentException if `capacity` is not positive
    public Roster(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    /// Seats a legislator if a seat is left.
    ///
    /// @param legislator the member to seat, not null
    /// @return `true` if seated, `false` if every seat is already filled
    public boolean seat(Legislator legislator) {
        if (isFull()) {
            return false;
        }
        members.add(legislator);
        return true;
    }

    public boolean isFull() {
        return members.size() >= capacity;
    }

    public int remainingSeats() {
        return capacity - members.size();
    }

    /// Orders members ascending by ideal point.
    public void sortByIdeal() {
        members.sort(BY_IDEAL);
    }

    /// Returns the ideal point of the member in the median seat.
    ///
    /// The median seat is index `size() / 2` of the sorted roster: index 50 for a full
    /// 101-seat chamber.
    ///
    /// @return median ideal point
    /// @throws IllegalStateException if the roster is empty
    /// @see #sortByIdeal()
    public double medianIdeal() {
        if (members.isEmpty()) {
            throw new IllegalStateException("Cannot take the median of an empty roster");
        }
        return members.get(members.size() / 2).getIdeal();
    }

    /// Returns the member at the given seat index.
    ///
    /// @param index zero-based seat index
    /// @return the seated legislator, never null
    public Legislator get(int index) {
        return members.get(index);
    }

    /// Returns an unmodifiable view of the seated members in seat order.
    public List<Legislator> members() {
        return Collections.unmodifiableList(members);
    }

    public int size() {
        return members.size();
    }

    public int capacity() {
        return capacity;
    }
}
