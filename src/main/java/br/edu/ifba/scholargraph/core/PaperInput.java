package br.edu.ifba.scholargraph.core;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * Paper data handed over by an acquisition collaborator.
 */
public record PaperInput(
        String title,
        @Nullable String abstractText,
        @Nullable String fullText,
        List<String> authors,
        @Nullable String externalId,
        @Nullable String doi,
        @Nullable LocalDate publicationDate,
        @Nullable String venue) {

    public PaperInput {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String title;
        private String abstractText;
        private String fullText;
        private final List<String> authors = new ArrayList<>();
        private String externalId;
        private String doi;
        private LocalDate publicationDate;
        private String venue;

        private Builder() {
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder abstractText(String abstractText) {
            this.abstractText = abstractText;
            return this;
        }

        public Builder fullText(String fullText) {
            this.fullText = fullText;
            return this;
        }

        public Builder authors(List<String> authors) {
            this.authors.clear();
            if (authors != null) {
                this.authors.addAll(authors);
            }
            return this;
        }

        public Builder author(String author) {
            this.authors.add(author);
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder doi(String doi) {
            this.doi = doi;
            return this;
        }

        public Builder publicationDate(LocalDate publicationDate) {
            this.publicationDate = publicationDate;
            return this;
        }

        public Builder venue(String venue) {
            this.venue = venue;
            return this;
        }

        public PaperInput build() {
            return new PaperInput(title, abstractText, fullText, authors, externalId, doi, publicationDate, venue);
        }
    }
}
