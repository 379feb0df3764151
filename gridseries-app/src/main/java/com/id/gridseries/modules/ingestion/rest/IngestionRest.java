package com.id.gridseries.modules.ingestion.rest;

import com.id.gridseries.modules.ingestion.exception.ChunkTransformException;
import com.id.gridseries.modules.ingestion.exception.IngestionAbortedException;
import com.id.gridseries.modules.ingestion.exception.LoadFailedException;
import com.id.gridseries.modules.ingestion.exception.SourceNotFoundException;
import com.id.gridseries.modules.ingestion.exception.SourceReadException;
import com.id.gridseries.modules.ingestion.model.IngestionRequest;
import com.id.gridseries.modules.ingestion.model.IngestionSummary;
import com.id.gridseries.modules.ingestion.service.IngestionService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("ingestion")
public class IngestionRest {

    private final IngestionService ingestionService;

    public IngestionRest(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping("jobs")
    public IngestionSummary ingest(@RequestBody IngestionRequest req) {
        try {
            return ingestionService.ingest(req);
        } catch (SourceNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (IngestionAbortedException | ChunkTransformException e) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), e);
        } catch (SourceReadException | LoadFailedException e) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
