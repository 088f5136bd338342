package net.neurod3.util;

/**
 * Central repository for shared literal values to reduce duplication.
 */
public final class ApplicationConstants {
    private ApplicationConstants() {
    }

    public static final class Paging {
        public static final int DEFAULT_PAGE_SIZE = 25;
        public static final int MIN_PAGE_SIZE = 1;
        public static final int MAX_PAGE_SIZE = 500;

        private Paging() {
        }
    }

    public static final class Dedup {
        public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.6;

        private Dedup() {
        }
    }

    public static final class Relations {
        public static final String UNIFIED_VIEW = "unified_datasets";
        public static final String NEURO_TABLE = "neuroscience_datasets";
        public static final String DANDI_TABLE = "dandi_dataset";

        private Relations() {
        }
    }

    public static final class Messages {
        public static final String CATALOG_MISSING =
            "No dataset tables or view found. Run the populate_neuroscience_datasets and dandi_ingestion jobs "
                + "or POST /api/refresh-view after tables exist.";

        private Messages() {
        }
    }
}
