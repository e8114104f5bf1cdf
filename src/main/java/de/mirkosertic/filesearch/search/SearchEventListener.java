package de.mirkosertic.filesearch.search;

/**
 * Receives the batches and the completion of an asynchronous search. Calls for one session key never
 * overlap. Once a newer search with the same key has started, no further batch of the older one arrives.
 */
public interface SearchEventListener {

    void onBatch(SearchSession session, ResultBatch batch);

    void onComplete(SearchSession session, SearchCompletion completion);
}
