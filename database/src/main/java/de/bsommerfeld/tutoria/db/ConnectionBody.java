package de.bsommerfeld.tutoria.db;

/**
 * Work that needs a connected {@link DatabaseClient}. Runs on the loop thread.
 */
@FunctionalInterface
public interface ConnectionBody<T> {

    T apply(DatabaseClient client);
}
