package com.scriptdeck.runner.api;

import com.scriptdeck.runner.api.dto.RepoFilesResponse;
import com.scriptdeck.runner.catalog.ScriptCatalog;
import com.scriptdeck.runner.catalog.ScriptNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Read-only listing of what can be run.
 *
 * GET /scripts               : script names in the scripts directory
 * GET /repos                 : provisioned repository ids
 * GET /repo_files/{repoId}   : runnable files inside one repository
 */
@RestController
public class CatalogController {

    private final ScriptCatalog catalog;

    public CatalogController(ScriptCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/scripts")
    public List<String> scripts() {
        return catalog.listScripts();
    }

    @GetMapping("/repos")
    public List<String> repos() {
        return catalog.listRepos();
    }

    @GetMapping("/repo_files/{repoId}")
    public RepoFilesResponse repoFiles(@PathVariable String repoId) {
        try {
            return new RepoFilesResponse(repoId, catalog.listRepoFiles(repoId));
        } catch (ScriptNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }
}
