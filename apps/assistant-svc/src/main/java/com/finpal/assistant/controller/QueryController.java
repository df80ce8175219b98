package com.finpal.assistant.controller;

import com.finpal.assistant.controller.dto.QueryRequestDto;
import com.finpal.assistant.controller.dto.QueryResponseDto;
import com.finpal.assistant.query.QueryService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class QueryController {

    private final QueryService queryService;
    private final LenientRequestBodyReader bodyReader;

    public QueryController(QueryService queryService, LenientRequestBodyReader bodyReader) {
        this.queryService = queryService;
        this.bodyReader = bodyReader;
    }

    @PostMapping(path = "/query", produces = MediaType.APPLICATION_JSON_VALUE)
    public QueryResponseDto query(@RequestBody(required = false) String body) {
        QueryRequestDto request = bodyReader.read(body, QueryRequestDto.class, QueryRequestDto::empty);
        return new QueryResponseDto(queryService.respond(request.phone(), request.message()));
    }
}
