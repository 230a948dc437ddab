package com.missionmind.api;

import com.missionmind.service.AuthorityService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/authorities")
public class AuthorityController {

    private final AuthorityService authorityService;

    public AuthorityController(AuthorityService authorityService) {
        this.authorityService = authorityService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AuthorityResponse create(@Valid @RequestBody AuthorityRequest request) {
        return AuthorityResponse.from(authorityService.create(request));
    }

    @GetMapping
    public List<AuthorityResponse> list(@RequestParam(value = "orgUnitId", required = false) String orgUnitId) {
        return authorityService.list(orgUnitId).stream()
                .map(AuthorityResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public AuthorityResponse get(@PathVariable String id) {
        return AuthorityResponse.from(authorityService.get(id));
    }
}
