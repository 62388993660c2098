package com.meisai.ingest.session;

import com.meisai.common.model.ImportProgress;

/** Called synchronously, in order, for every snapshot a session emits. */
@FunctionalInterface
public interface ProgressListener {
    void onProgress(ImportProgress progress);
}
