package com.enterprise.jobly.company.infrastructure;

import com.enterprise.jobly.company.application.CompanyQueries;
import com.enterprise.jobly.company.application.CompanyService;
import com.enterprise.jobly.company.domain.Company;
import com.enterprise.jobly.company.domain.CompanyDetail;
import com.enterprise.jobly.shared.validation.FilterParams;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/companies")
public class CompanyController {

    private final CompanyService companies;

    public CompanyController(CompanyService companies) {
        this.companies = companies;
    }

    public record NewCompanyRequest(
        @NotBlank @Size(max = 25) @Pattern(regexp = "[a-z0-9-]+") String handle,
        @NotBlank String name,
        @NotBlank String description,
        @PositiveOrZero Integer numEmployees,
        String logoUrl
    ) {
        Company toCompany() {
            return new Company(handle, name, description, numEmployees, logoUrl);
        }
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Company> create(@Valid @RequestBody NewCompanyRequest request) {
        return Map.of("company", companies.create(request.toCompany()));
    }

    /** Query string: name, minEmployees, maxEmployees. */
    @GetMapping
    public Map<String, List<Company>> findAll(@RequestParam Map<String, String> params) {
        return Map.of("companies", companies.findAll(FilterParams.coerce(CompanyQueries.FILTERS, params)));
    }

    @GetMapping("/{handle}")
    public Map<String, CompanyDetail> get(@PathVariable String handle) {
        return Map.of("company", companies.get(handle));
    }

    @PatchMapping("/{handle}")
    public Map<String, Company> update(@PathVariable String handle, @RequestBody Map<String, Object> data) {
        return Map.of("company", companies.update(handle, data));
    }

    @DeleteMapping("/{handle}")
    public Map<String, String> remove(@PathVariable String handle) {
        companies.remove(handle);
        return Map.of("deleted", handle);
    }
}
