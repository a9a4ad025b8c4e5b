/*
 * Copyright 2026 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.anomalytimes.artifacts;

/**
 * State of a cache key, derived from the artifact store on every resolution
 * and never stored.
 */
public enum CacheState {
    /**
     * No artifact is stored at the key.
     */
    NO_ENTRY(CacheAction.REFIT),
    /**
     * The artifact is younger than the expiration.
     */
    FRESH(CacheAction.LOAD),
    /**
     * The artifact is at least as old as the expiration.
     */
    STALE(CacheAction.REFIT),
    /**
     * The store could not be probed.
     */
    UNKNOWN(CacheAction.REFIT);

    CacheState(final CacheAction action) {
        _action = action;
    }

    public CacheAction getAction() {
        return _action;
    }

    private final CacheAction _action;
}
