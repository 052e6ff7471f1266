package com.flamingo.ai.tenderlens.config;

import java.util.ArrayList;
import java.util.List;

/** Built-in rule tables used when {@code application.yml} does not override them. */
public final class DefaultRules {

  private DefaultRules() {}

  /** Filename markers that guarantee a technical document. */
  public static final List<String> INCLUDE_MARKERS =
      List.of(
          "тз", "техническое задание", "описание объекта", "описание закупки",
          "ведомость поставки", "спецификация", "размеры", "габариты",
          "сорт", "состав продукции", "характеристики", "параметры",
          "гост", "ту", "условия поставки", "требования к товару",
          "потребительские свойства", "качество товара", "декларация соответствия");

  /** Filename markers of contractual, legal and administrative paperwork. */
  public static final List<String> EXCLUDE_MARKERS =
      List.of(
          "контракт", "договор", "проект контракта", "проект договора",
          "инструкция", "требования к заявке", "состав заявки", "оформление заявки",
          "заявка", "заявление", "нмцк", "обоснование", "расчет",
          "уведомление", "гарантия", "обязательство", "оценка",
          "методика", "баллы", "контроль", "лист согласования",
          "форма", "цп", "решение", "протокол", "анкета",
          "согласие", "образец заполнения", "реквизиты", "регистр",
          "сведения о заказчике", "данные заказчика", "сопроводительное",
          "участник закупки", "участника", "отчет");

  /** Line substrings that mark procedural or legal boilerplate. */
  public static final List<String> BOILERPLATE_MARKERS =
      List.of(
          // participants and applications
          "участник закупки", "оформление заявки", "подача заявки",
          "сведения о заказчике", "данные заказчика", "информация о заказчике",
          "участника закупки", "участников закупки", "заявка на участие",
          // contractual obligations
          "контракт вступает в силу", "права и обязанности сторон",
          "порядок расчетов", "оплата осуществляется", "срок оплаты",
          "гарантийное обязательство", "ответственность сторон",
          "реквизиты сторон", "расторжение контракта", "форс-мажор",
          "конфиденциальность", "порядок приемки", "акт выполненных работ",
          // legal citations
          "в соответствии со статьей", "на основании приказа",
          "в случае", "при нарушении", "в установленном порядке",
          "согласно требованиям", "в порядке", "в соответствии с",
          "настоящий контракт", "настоящий договор", "стороны договорились",
          // submission procedure
          "порядок подачи", "срок подачи", "место подачи", "способ подачи",
          "требования к оформлению", "состав заявки", "форма заявки",
          "критерии оценки", "методика оценки", "баллы", "оценка заявок",
          // bureaucratic acknowledgements
          "приложение к контракту", "приложение к договору",
          "неотъемлемая часть", "является неотъемлемой частью",
          "вступает в силу", "действует до", "действует с",
          "утверждено", "согласовано", "одобрено", "принято",
          "приложение", "приложения",
          // signature and approval metadata
          "лист согласования", "виза", "подпись", "дата", "номер",
          "регистрационный номер", "инвентарный номер", "код",
          "форма", "бланк", "шаблон", "образец", "реквизиты",
          // filler blocks
          "дополнительная информация", "примечания", "примечание",
          "особые условия", "дополнительные условия", "иные условия",
          "прочие условия", "прочее", "другое", "иное");

  /** Text markers that show a document carries technical requirements. */
  public static final List<String> USEFUL_CONTENT_MARKERS =
      List.of(
          "наименование товара", "характеристики", "срок поставки", "требования к",
          "техническое задание", "гост", "ту", "упаковка", "сорт", "размер",
          "технические характеристики", "параметры", "спецификация", "описание",
          "качество", "марка", "тип", "модель", "комплектация", "состав");

  /** Vocabulary of lines worth keeping when only technical information is wanted. */
  public static final List<String> TECHNICAL_KEYWORDS =
      List.of(
          "технические характеристики", "характеристики", "параметры",
          "размеры", "габариты", "вес", "масса", "объем", "количество",
          "гост", "ту", "стандарт", "требования к", "качество", "сорт",
          "марка", "тип", "модель", "наименование", "название товара",
          "упаковка", "тара", "срок поставки", "сроки", "место поставки",
          "условия поставки", "комплектация", "состав", "материал",
          "цвет", "размер", "длина", "ширина", "высота", "диаметр");

  /** Key-section rules, in evaluation order. */
  public static List<PipelineConfig.KeySection> keySections() {
    List<PipelineConfig.KeySection> rules = new ArrayList<>();
    rules.add(section("требования.*качеств", "Требования к качеству товара", "качеств"));
    rules.add(section("гарантийный\\s+срок", "Гарантийный срок", "гарантий"));
    rules.add(section("требования.*упаковк", "Требования к упаковке", "упаковк|маркировк"));
    rules.add(section("срок\\s+поставк", "Срок поставки", "срок"));
    rules.add(section("место\\s+поставк", "Место поставки", "адрес"));
    rules.add(section("поставляемый\\s+товар", "Поставляемый товар", "поставляем"));
    rules.add(section("товар\\s+должен", "Требования к товару", "должен\\s+соответствовать"));
    rules.add(
        section("технические\\s+характеристик", "Технические характеристики", "характеристик"));
    rules.add(section("условия\\s+поставк", "Условия поставки", "поставк"));
    rules.add(section("условия\\s+оплат", "Условия оплаты", "оплат"));
    rules.add(section("ответственность", "Ответственность сторон", "неустойк|штраф"));
    rules.add(section("форс-мажор", "Форс-мажор", "непреодолимой\\s+силы"));
    rules.add(section("расторжение\\s+контракт", "Расторжение контракта", "расторж"));
    rules.add(section("при[её]мка\\s+товар", "Приёмка товара", "при[её]мк"));
    rules.add(section("документация", "Документация", "сертификат|паспорт"));
    rules.add(
        section(
            "энергетическая\\s+эффективность", "Энергетическая эффективность", "энергоэффектив"));
    return rules;
  }

  private static PipelineConfig.KeySection section(
      String pattern, String header, String vocabulary) {
    return new PipelineConfig.KeySection(pattern, header, vocabulary);
  }
}
