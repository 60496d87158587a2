package ai.i18next.parser.types;

import static org.assertj.core.api.Assertions.assertThat;

import ai.i18next.parser.catalog.CatalogTree;
import ai.i18next.parser.config.Config;
import ai.i18next.parser.merge.MergeResult;
import ai.i18next.parser.reconcile.NamespaceReconciliation;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TypesGeneratorTest {

    @TempDir
    Path tempDir;

    @Test
    void rendersImportsResourcesAndNamespaceUnion() {
        Config config = Config.builder().workingDir(tempDir).locales(List.of("en", "pt-BR")).build();
        List<NamespaceReconciliation> results = List.of(
                result(config, "en", "common"),
                result(config, "en", "my-page"),
                result(config, "pt-BR", "common"));

        String content = new TypesGenerator(config).render(results, tempDir.resolve("src/@types"));

        assertThat(content).startsWith("/* eslint-disable */\n\nimport 'i18next';\n");
        assertThat(content).contains("import type common_en from '../../locales/en/common.json';");
        assertThat(content).contains("import type myPage_en from '../../locales/en/my-page.json';");
        assertThat(content).contains("import type common_pt_BR from '../../locales/pt-BR/common.json';");
        assertThat(content).contains("defaultNS: 'translation';");
        assertThat(content).contains("en: {\n        common: typeof common_en;\n        'my-page': typeof myPage_en;\n      },");
        assertThat(content).contains("'pt-BR': {\n        common: typeof common_pt_BR;\n      },");
        assertThat(content).contains("type Ns = 'common' | 'my-page';");
        assertThat(content).endsWith("export default {};\n");
    }

    @Test
    void importsBelowTheDeclarationDirectoryStartWithDot() {
        Config config = Config.builder().workingDir(tempDir).build();

        String content = new TypesGenerator(config).render(List.of(result(config, "en", "common")), tempDir);

        assertThat(content).contains("import type common_en from './locales/en/common.json';");
    }

    @Test
    void generateWritesConfiguredFile() throws Exception {
        Config config = Config.builder().workingDir(tempDir).generatedTypes("types/i18n.d.ts").build();

        Path written = new TypesGenerator(config).generate(List.of(result(config, "en", "common")));

        assertThat(written).isEqualTo(tempDir.resolve("types/i18n.d.ts"));
        assertThat(Files.readString(written)).contains("from '../locales/en/common.json'");
    }

    @Test
    void camelizeTreatsSeparatorsAsWordBreaks() {
        assertThat(TypesGenerator.camelize("my-page")).isEqualTo("myPage");
        assertThat(TypesGenerator.camelize("Admin_Users.list")).isEqualTo("adminUsersList");
        assertThat(TypesGenerator.camelize("common")).isEqualTo("common");
    }

    private static NamespaceReconciliation result(Config config, String locale, String namespace) {
        Path path = config.outputPath(locale, namespace);
        MergeResult merged = MergeResult.unchanged(CatalogTree.empty());
        return new NamespaceReconciliation(locale, namespace, path, Config.backupPath(path), Optional.empty(),
                merged, merged, CatalogTree.empty(), 0, 0);
    }
}
