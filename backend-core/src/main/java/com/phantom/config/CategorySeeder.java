package com.phantom.config;

import com.phantom.domain.enums.DefaultCategory;
import com.phantom.domain.model.Category;
import com.phantom.repository.CategoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class CategorySeeder implements ApplicationRunner {

    private final CategoryRepository categoryRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        List<String> created = seedDefaults();
        if (created.isEmpty()) {
            log.info("Default categories already present: {}", categoryRepository.count());
        } else {
            log.info("Seeded default categories: {}", created);
        }
    }

    public List<String> seedDefaults() {
        List<String> created = new ArrayList<>();
        for (DefaultCategory defaults : DefaultCategory.values()) {
            if (categoryRepository.findByName(defaults.displayName()).isPresent()) {
                continue;
            }
            categoryRepository.save(new Category(
                    defaults.displayName(),
                    defaults.priorityLevel(),
                    defaults.color(),
                    defaults.description()));
            created.add(defaults.displayName());
        }
        return created;
    }
}
