package com.missionmind.api;

import com.missionmind.service.OrgUnitService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/orgunits")
public class OrgUnitController {

    private final OrgUnitService orgUnitService;

    public OrgUnitController(OrgUnitService orgUnitService) {
        this.orgUnitService = orgUnitService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public OrgUnitResponse create(@Valid @RequestBody OrgUnitRequest request) {
        return OrgUnitResponse.from(orgUnitService.create(request));
    }

    @GetMapping
    public List<OrgUnitResponse> list(@RequestParam(value = "parentId", required = false) String parentId,
                                      @RequestParam(value = "echelon", required = false) String echelon) {
        return orgUnitService.list(parentId, echelon).stream()
                .map(OrgUnitResponse::from)
                .toList();
    }

    @GetMapping("/tree")
    public List<OrgUnitResponse> tree(@RequestParam(value = "rootId", required = false) String rootId) {
        return orgUnitService.tree(rootId).stream()
                .map(OrgUnitResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public OrgUnitResponse get(@PathVariable String id) {
        return OrgUnitResponse.from(orgUnitService.get(id));
    }

    @PatchMapping("/{id}")
    public OrgUnitResponse update(@PathVariable String id, @RequestBody OrgUnitUpdateRequest request) {
        return OrgUnitResponse.from(orgUnitService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public OrgUnitResponse deactivate(@PathVariable String id) {
        return OrgUnitResponse.from(orgUnitService.deactivate(id));
    }

    @GetMapping("/{id}/ancestors")
    public List<OrgUnitResponse> ancestors(@PathVariable String id) {
        return orgUnitService.ancestors(id).stream()
                .map(OrgUnitResponse::from)
                .toList();
    }
}
