package de.bsommerfeld.tutoria.db.loop;

/**
 * One opaque piece of database work, executed on the loop thread. Whatever it
 * throws reaches the submitting thread unchanged.
 */
@FunctionalInterface
public interface UnitOfWork<T> {

    T execute();
}
