package com.penny.ledger.controller;

import com.penny.ledger.category.CategoryService;
import com.penny.ledger.controller.dto.CategoryMoveRequestDto;
import com.penny.ledger.controller.dto.CountResponseDto;
import com.penny.ledger.model.Category;
import com.penny.ledger.model.CategoryDraft;
import com.penny.ledger.model.CategoryUpdate;
import com.penny.ledger.model.ShadowCategories;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/categories")
public class CategoriesController {

    private final CategoryService categoryService;

    public CategoriesController(CategoryService categoryService) {
        this.categoryService = categoryService;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Category> listCategories(@RequestParam(name = "includeShadow", defaultValue = "false") boolean includeShadow) {
        return categoryService.getAllCategories(includeShadow);
    }

    @GetMapping(path = "/shadow", produces = MediaType.APPLICATION_JSON_VALUE)
    public ShadowCategories shadowCategories() {
        return categoryService.getShadowCategories();
    }

    @GetMapping(path = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Category getCategory(@PathVariable String id) {
        return categoryService.requireCategory(id);
    }

    @GetMapping(path = "/{id}/children", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Category> children(@PathVariable String id) {
        return categoryService.getChildCategories(id);
    }

    @GetMapping(path = "/{id}/descendants", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Category> descendants(@PathVariable String id) {
        categoryService.requireCategory(id);
        return categoryService.getAllDescendants(id);
    }

    @GetMapping(path = "/{id}/path", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Category> path(@PathVariable String id) {
        categoryService.requireCategory(id);
        return categoryService.getCategoryPath(id);
    }

    @GetMapping(path = "/{id}/usage", produces = MediaType.APPLICATION_JSON_VALUE)
    public CountResponseDto usage(@PathVariable String id) {
        return new CountResponseDto(categoryService.countCategoryUsage(id));
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Category createCategory(@RequestBody CategoryDraft request) {
        return categoryService.createCategory(request);
    }

    @PatchMapping(path = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Category updateCategory(@PathVariable String id, @RequestBody CategoryUpdate request) {
        return categoryService.updateCategory(id, request);
    }

    @PostMapping("/{id}/move")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void moveCategory(@PathVariable String id, @RequestBody CategoryMoveRequestDto request) {
        categoryService.moveCategory(id, request.parentId());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteCategory(@PathVariable String id) {
        categoryService.deleteCategory(id);
    }
}
