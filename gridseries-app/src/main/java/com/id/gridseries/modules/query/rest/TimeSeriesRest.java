package com.id.gridseries.modules.query.rest;

import com.id.gridseries.model.TimeSeriesPoint;
import com.id.gridseries.modules.query.exception.DatasetNotFoundException;
import com.id.gridseries.modules.query.service.TimeSeriesQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.function.Supplier;

@RestController
@RequestMapping("data")
public class TimeSeriesRest {

    private final TimeSeriesQueryService queryService;

    public TimeSeriesRest(TimeSeriesQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("aggregated/{tableName}")
    public List<TimeSeriesPoint> aggregated(@PathVariable("tableName") String tableName,
                                            @RequestParam("start_time") String startTime,
                                            @RequestParam("end_time") String endTime,
                                            @RequestParam(value = "resolution", required = false) String resolution) {
        return handle(() -> queryService.aggregated(tableName, startTime, endTime, resolution));
    }

    @GetMapping("raw/{tableName}")
    public List<TimeSeriesPoint> raw(@PathVariable("tableName") String tableName,
                                     @RequestParam("start_time") String startTime,
                                     @RequestParam("end_time") String endTime) {
        return handle(() -> queryService.raw(tableName, startTime, endTime));
    }

    private List<TimeSeriesPoint> handle(Supplier<List<TimeSeriesPoint>> query) {
        try {
            return query.get();
        } catch (DatasetNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
