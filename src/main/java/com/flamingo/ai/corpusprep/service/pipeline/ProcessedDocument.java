package com.flamingo.ai.corpusprep.service.pipeline;

import com.flamingo.ai.corpusprep.service.model.Chunk;
import com.flamingo.ai.corpusprep.service.model.Document;
import java.util.List;

/**
 * A normalized document with all of its chunks.
 *
 * @param document the document, its text already normalized
 * @param chunks chunks in emission order
 */
record ProcessedDocument(Document document, List<Chunk> chunks) {}
