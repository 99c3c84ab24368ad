package com.deskpilot.rag.structured;

import com.deskpilot.model.QueryOptions;
import com.deskpilot.model.RecordKind;
import com.deskpilot.model.StructuredRecord;
import com.deskpilot.util.KeywordExtractor;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Set;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

/**
 * Looks up closed tickets and knowledge-base articles whose title or body mentions one of
 * the query keywords. Never writes to either collection.
 */
@Component
public class MongoStructuredSearchAdapter implements StructuredSearchAdapter {
    private static final Logger log = LoggerFactory.getLogger(MongoStructuredSearchAdapter.class);
    private static final int MAX_QUERY_KEYWORDS = 5;
    private final MongoTemplate mongoTemplate;

    @Value("${deskpilot.structured.tickets-collection:tickets}")
    private String ticketsCollection = "tickets";

    @Value("${deskpilot.structured.kb-collection:kb_articles}")
    private String kbCollection = "kb_articles";

    @Value("${deskpilot.structured.closed-status:Closed}")
    private String closedStatus = "Closed";

    public MongoStructuredSearchAdapter(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<StructuredRecord> searchRelevant(String query, int limit, QueryOptions options) {
        QueryOptions effective = options != null ? options : QueryOptions.DEFAULT;
        Set<String> keywords = KeywordExtractor.extract(query);
        if (keywords.isEmpty() || limit <= 0 || !effective.includesStructured()) {
            return List.of();
        }
        List<String> terms = keywords.stream().limit(MAX_QUERY_KEYWORDS).toList();
        ArrayList<StructuredRecord> records = new ArrayList<>();
        if (effective.includeKb()) {
            Query kbQuery = new Query(withCategory(keywordCriteria(terms, "title", "content"), effective)).limit(limit);
            for (Document doc : this.mongoTemplate.find(kbQuery, Document.class, this.kbCollection)) {
                records.add(new StructuredRecord(idOf(doc), doc.getString("title"), doc.getString("content"),
                        RecordKind.KB_ARTICLE, instantOf(doc), doc.getString("category"), doc.getString("url")));
            }
        }
        if (effective.includeTickets()) {
            Query ticketQuery = new Query(withCategory(new Criteria().andOperator(
                    Criteria.where("status").is(this.closedStatus),
                    keywordCriteria(terms, "title", "description", "resolution")), effective)).limit(limit);
            for (Document doc : this.mongoTemplate.find(ticketQuery, Document.class, this.ticketsCollection)) {
                records.add(new StructuredRecord(idOf(doc), doc.getString("title"), ticketText(doc),
                        RecordKind.TICKET, instantOf(doc), doc.getString("category"), null));
            }
        }
        log.debug("Structured search matched {} kb articles and tickets for {} keywords (category={})",
                records.size(), terms.size(), effective.categoryFilter());
        return records;
    }

    private static Criteria withCategory(Criteria criteria, QueryOptions options) {
        if (!options.hasCategoryFilter()) {
            return criteria;
        }
        return new Criteria().andOperator(criteria,
                Criteria.where("category").regex("^" + escapeRegex(options.categoryFilter()) + "$", "i"));
    }

    private static Criteria keywordCriteria(List<String> terms, String... fields) {
        ArrayList<Criteria> any = new ArrayList<>();
        for (String term : terms) {
            for (String field : fields) {
                any.add(Criteria.where(field).regex(escapeRegex(term), "i"));
            }
        }
        return new Criteria().orOperator(any.toArray(new Criteria[0]));
    }

    private static String ticketText(Document doc) {
        String description = doc.getString("description");
        String resolution = doc.getString("resolution");
        StringBuilder text = new StringBuilder(description != null ? description : "");
        if (resolution != null && !resolution.isBlank()) {
            text.append("\nResolution: ").append(resolution);
        }
        return text.toString();
    }

    private static String idOf(Document doc) {
        Object id = doc.get("ticketNumber") != null ? doc.get("ticketNumber") : doc.get("_id");
        return String.valueOf(id);
    }

    private static Instant instantOf(Document doc) {
        Object value = doc.get("updatedAt") != null ? doc.get("updatedAt") : doc.get("createdAt");
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        return null;
    }

    private static String escapeRegex(String text) {
        return text.replaceAll("([\\\\\\^\\$\\.\\|\\?\\*\\+\\(\\)\\[\\]\\{\\}])", "\\\\$1");
    }
}
