package github.sarthakdev143.hdr_merge.service;

/**
 * Receives progress of a load or save, synchronously on the worker thread.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (percent, message, argument) -> {
    };

    /**
     * @param percent  progress in {@code [0, 100]}
     * @param message  phase label, possibly containing a {@code %1} placeholder
     * @param argument value for the placeholder, or {@code null}
     */
    void onProgress(int percent, String message, String argument);

    static String format(String message, String argument) {
        return argument == null ? message : message.replace("%1", argument);
    }
}
